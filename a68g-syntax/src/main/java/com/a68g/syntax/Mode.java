package com.a68g.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Algol 68 模式（类型）。
 * <p>
 * 只读；标准模式为单例，派生模式按结构比较。
 * {@link #getSub()} 的含义随种类不同：REF 的被引用模式、ROW 的元素模式、PROC 的结果模式。
 * {@link #getDim()} 对 ROW 为维数，对 PROC 为参数个数。
 */
public final class Mode {

    public enum Kind { STANDARD, REF, ROW, STRUCT, UNION, PROC, VOID }

    /** 运行时对象大小（字节），与解释器的 A68_INT 等布局一致 */
    private static final int SIZE_INT = 16;
    private static final int SIZE_REAL = 16;
    private static final int SIZE_BOOL = 8;
    private static final int SIZE_CHAR = 8;
    private static final int SIZE_BITS = 16;
    private static final int SIZE_REF = 24;
    private static final int SIZE_PROC = 40;

    /** 多精度数位数（LONG 模式） */
    public static final int LONG_MP_DIGITS = 6;

    public static final Mode INT = new Mode(Kind.STANDARD, "INT", null, 0, null, null, SIZE_INT);
    public static final Mode REAL = new Mode(Kind.STANDARD, "REAL", null, 0, null, null, SIZE_REAL);
    public static final Mode BOOL = new Mode(Kind.STANDARD, "BOOL", null, 0, null, null, SIZE_BOOL);
    public static final Mode CHAR = new Mode(Kind.STANDARD, "CHAR", null, 0, null, null, SIZE_CHAR);
    public static final Mode BITS = new Mode(Kind.STANDARD, "BITS", null, 0, null, null, SIZE_BITS);
    public static final Mode LONG_INT = new Mode(Kind.STANDARD, "LONG INT", null, 0, null, null, (2 + LONG_MP_DIGITS) * 8);
    public static final Mode LONG_REAL = new Mode(Kind.STANDARD, "LONG REAL", null, 0, null, null, (2 + LONG_MP_DIGITS) * 8);
    public static final Mode VOID = new Mode(Kind.VOID, "VOID", null, 0, null, null, 0);
    public static final Mode COMPLEX = new Mode(Kind.STRUCT, "COMPLEX", null, 0,
            List.of(new Field("re", REAL, 0), new Field("im", REAL, SIZE_REAL)), null, 2 * SIZE_REAL);

    private static final List<Mode> STANDARD_MODES = List.of(INT, REAL, BOOL, CHAR, BITS, LONG_INT, LONG_REAL, VOID, COMPLEX);

    private final Kind kind;
    private final String name;
    private final Mode sub;
    private final int dim;
    private final List<Field> fields;
    private final List<Mode> parameters;
    private final int size;

    private Mode(Kind kind, String name, Mode sub, int dim, List<Field> fields, List<Mode> parameters, int size) {
        this.kind = kind;
        this.name = name;
        this.sub = sub;
        this.dim = dim;
        this.fields = fields != null ? Collections.unmodifiableList(new ArrayList<>(fields)) : Collections.<Field>emptyList();
        this.parameters = parameters != null ? Collections.unmodifiableList(new ArrayList<>(parameters)) : Collections.<Mode>emptyList();
        this.size = size;
    }

    // ---- 工厂 ----

    public static Mode ref(Mode sub) {
        return new Mode(Kind.REF, null, Objects.requireNonNull(sub), 0, null, null, SIZE_REF);
    }

    public static Mode row(Mode element, int dim) {
        return new Mode(Kind.ROW, null, Objects.requireNonNull(element), dim, null, null, SIZE_REF);
    }

    public static Mode struct(List<Field> fields) {
        int size = 0;
        for (Field f : fields) size = Math.max(size, f.getOffset() + f.getMode().getSize());
        return new Mode(Kind.STRUCT, null, null, 0, fields, null, size);
    }

    public static Mode proc(List<Mode> parameters, Mode result) {
        return new Mode(Kind.PROC, null, Objects.requireNonNull(result), parameters.size(), null, parameters, SIZE_PROC);
    }

    public static Mode union(List<Mode> alternatives, int size) {
        return new Mode(Kind.UNION, null, null, 0, null, alternatives, size);
    }

    /** 覆盖运行时大小（由外部模式表提供） */
    public Mode withSize(int size) {
        if (kind == Kind.STANDARD || this == COMPLEX || this == VOID) {
            return this;
        }
        return new Mode(kind, name, sub, dim, fields, parameters, size);
    }

    /** 按名称查找标准模式，未知返回 null */
    public static Mode standard(String name) {
        for (Mode m : STANDARD_MODES) {
            if (m.name.equals(name)) return m;
        }
        return null;
    }

    // ---- 查询 ----

    public Kind getKind() { return kind; }
    public String getName() { return name; }
    public Mode getSub() { return sub; }
    public int getDim() { return dim; }
    public List<Field> getFields() { return fields; }
    public List<Mode> getParameters() { return parameters; }
    public int getSize() { return size; }

    public boolean isRef() { return kind == Kind.REF; }
    public boolean isRow() { return kind == Kind.ROW; }
    public boolean isStruct() { return kind == Kind.STRUCT; }
    public boolean isProc() { return kind == Kind.PROC; }
    public boolean isUnion() { return kind == Kind.UNION; }

    public boolean isLong() {
        return this == LONG_INT || this == LONG_REAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mode)) return false;
        Mode m = (Mode) o;
        if (kind == Kind.STANDARD || kind == Kind.VOID || m.kind == Kind.STANDARD) {
            return false;
        }
        return kind == m.kind && dim == m.dim
                && Objects.equals(name, m.name)
                && Objects.equals(sub, m.sub)
                && fields.equals(m.fields)
                && parameters.equals(m.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, sub, dim, fields, parameters);
    }

    @Override
    public String toString() {
        if (name != null) return name;
        switch (kind) {
            case REF: return "REF " + sub;
            case ROW: return "[" + ",".repeat(Math.max(0, dim - 1)) + "] " + sub;
            case PROC: {
                StringBuilder sb = new StringBuilder("PROC");
                if (!parameters.isEmpty()) {
                    sb.append(" (");
                    for (int i = 0; i < parameters.size(); i++) {
                        if (i > 0) sb.append(", ");
                        sb.append(parameters.get(i));
                    }
                    sb.append(")");
                }
                return sb.append(" ").append(sub).toString();
            }
            case STRUCT: {
                StringBuilder sb = new StringBuilder("STRUCT (");
                for (int i = 0; i < fields.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(fields.get(i));
                }
                return sb.append(")").toString();
            }
            case UNION: {
                StringBuilder sb = new StringBuilder("UNION (");
                for (int i = 0; i < parameters.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(parameters.get(i));
                }
                return sb.append(")").toString();
            }
            default:
                return kind.name();
        }
    }
}
