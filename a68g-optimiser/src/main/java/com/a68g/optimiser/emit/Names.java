package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;
import com.a68g.syntax.Mode;

/**
 * 生成代码中的名称。
 * <p>
 * 名称只由节点号、角色和模式决定，同一棵树两次生成的文本完全相同。
 */
public final class Names {

    /** 名称长度上限（不含） */
    public static final int NAME_SIZE = 200;

    // 角色缩写
    public static final String CON = "const";
    public static final String ELM = "elem";
    public static final String TMP = "tmp";
    public static final String ARG = "arg";
    public static final String ARR = "array";
    public static final String DEC = "declarer";
    public static final String DRF = "deref";
    public static final String DSP = "display";
    public static final String FUN = "function";
    public static final String PUP = "pop";
    public static final String SEL = "field";
    public static final String TUP = "tuple";

    private Names() {
    }

    /**
     * {@code genie_<name>_<tag>_<n>}，tag 为空时为 {@code genie_<name>_<n>}。
     *
     * @throws CodegenException 名称过长
     */
    public static String make(String name, String tag, int n) {
        String s = tag == null || tag.isEmpty()
                ? "genie_" + name + "_" + n
                : "genie_" + name + "_" + tag + "_" + n;
        return checked(s);
    }

    public static String make(String name, int n) {
        return make(name, "", n);
    }

    /** 共享函数名：{@code genie_<name>_<tag>_<ext>} */
    public static String unique(String name, String tag, String ext) {
        String s = tag == null || tag.isEmpty()
                ? "genie_" + name + "_" + ext
                : "genie_" + name + "_" + tag + "_" + ext;
        return checked(s);
    }

    private static String checked(String s) {
        if (s.length() >= NAME_SIZE) {
            throw new CodegenException("生成的名称过长: " + s.substring(0, 32) + "...");
        }
        return s;
    }

    /** 源符号中不能出现在 C 标识符里的字符替换为下划线 */
    public static String sanitise(String symbol) {
        StringBuilder sb = new StringBuilder(symbol.length());
        for (int i = 0; i < symbol.length(); i++) {
            char c = symbol.charAt(i);
            sb.append(c < 128 && (Character.isLetterOrDigit(c) || c == '_') ? c : '_');
        }
        return sb.toString();
    }

    /** 带模式的角色名，例如 {@code deref_REF_INT_identifier} */
    public static String withMode(String pre, Mode m, String post) {
        StringBuilder sb = new StringBuilder(pre);
        if (m != null && m.isRef()) {
            sb.append("REF_");
            m = m.getSub();
        }
        if (m == Mode.INT || m == Mode.REAL || m == Mode.BOOL || m == Mode.CHAR || m == Mode.BITS || m == Mode.VOID) {
            sb.append(m.getName());
        } else if (m == Mode.LONG_INT) {
            sb.append("LONG_INT");
        } else if (m == Mode.LONG_REAL) {
            sb.append("LONG_REAL");
        } else {
            sb.append("MODE");
        }
        return sb.append(post).toString();
    }

    /** 运行时的模式常量，用于诊断调用 */
    public static String internalMode(Mode m) {
        if (m == Mode.INT) return "M_INT";
        if (m == Mode.REAL) return "M_REAL";
        if (m == Mode.BOOL) return "M_BOOL";
        if (m == Mode.CHAR) return "M_CHAR";
        if (m == Mode.BITS) return "M_BITS";
        if (m == Mode.COMPLEX) return "M_COMPLEX";
        if (m == Mode.LONG_INT) return "M_LONG_INT";
        if (m == Mode.LONG_REAL) return "M_LONG_REAL";
        return "M_ERROR";
    }

    /** 模式对应的运行时 C 类型 */
    public static String inlineMode(Mode m) {
        if (m == Mode.INT) return "A68_INT";
        if (m == Mode.REAL) return "A68_REAL";
        if (m == Mode.BOOL) return "A68_BOOL";
        if (m == Mode.CHAR) return "A68_CHAR";
        if (m == Mode.BITS) return "A68_BITS";
        if (m == Mode.COMPLEX) return "A68_COMPLEX";
        if (m != null && m.isLong()) return "A68_LONG";
        if (m == null) return "A68_ERROR";
        switch (m.getKind()) {
            case REF:
                return "A68_REF";
            case ROW:
                return "A68_ROW";
            case PROC:
                return "A68_PROCEDURE";
            case STRUCT:
                return "A68_STRUCT";
            default:
                return "A68_ERROR";
        }
    }
}
