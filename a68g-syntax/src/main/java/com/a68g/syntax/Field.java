package com.a68g.syntax;

import java.util.Objects;

/**
 * 结构体字段：名称、模式与在结构体中的字节偏移。
 */
public final class Field {
    private final String name;
    private final Mode mode;
    private final int offset;

    public Field(String name, Mode mode, int offset) {
        this.name = Objects.requireNonNull(name, "name");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.offset = offset;
    }

    public String getName() { return name; }
    public Mode getMode() { return mode; }
    public int getOffset() { return offset; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field)) return false;
        Field f = (Field) o;
        return offset == f.offset && name.equals(f.name) && mode.equals(f.mode);
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + mode.hashCode()) * 31 + offset;
    }

    @Override
    public String toString() {
        return mode + " " + name;
    }
}
