package com.a68g.syntax;

/**
 * 源码位置信息
 */
public final class SourceLocation {
    private final String file;
    private final int line;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0);

    public SourceLocation(String file, int line) {
        this.file = file != null ? file.intern() : "<unknown>";
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
