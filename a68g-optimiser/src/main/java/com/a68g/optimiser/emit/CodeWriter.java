package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;

import java.util.Locale;

/**
 * 生成代码的输出缓冲，带缩进计数。
 * <p>
 * {@code indent} 系列在文本前写当前缩进，{@code undent} 系列原样追加。
 */
public final class CodeWriter {
    private static final String INDENT_UNIT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int indentation;

    public CodeWriter indent(String text) {
        for (int i = 0; i < indentation; i++) {
            out.append(INDENT_UNIT);
        }
        out.append(text);
        return this;
    }

    public CodeWriter indentf(String format, Object... args) {
        return indent(String.format(Locale.ROOT, format, args));
    }

    public CodeWriter undent(String text) {
        out.append(text);
        return this;
    }

    public CodeWriter undentf(String format, Object... args) {
        return undent(String.format(Locale.ROOT, format, args));
    }

    /** 缩进加一级 */
    public void in() {
        indentation++;
    }

    /** 缩进减一级 */
    public void out() {
        if (indentation == 0) {
            throw new CodegenException("缩进计数为负");
        }
        indentation--;
    }

    public int getIndentation() {
        return indentation;
    }

    public int length() {
        return out.length();
    }

    public String text() {
        return out.toString();
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
