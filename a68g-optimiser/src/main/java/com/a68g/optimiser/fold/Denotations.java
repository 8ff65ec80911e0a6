package com.a68g.optimiser.fold;

import com.a68g.optimiser.primitive.Value;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * 指称的文本与取值。
 */
public final class Denotations {

    private Denotations() {
    }

    /**
     * 指称的源文本。DENOTATION 节点自身无符号时取子节点的符号，跳过 SHORTETY 与 LONGETY。
     */
    public static String text(Node p) {
        if (!p.getSymbol().isEmpty()) {
            return p.getSymbol();
        }
        for (Node q = p.getSub(); q != null; q = q.getNext()) {
            if (q.is(Attribute.SHORTETY) || q.is(Attribute.LONGETY)) {
                continue;
            }
            if (!q.getSymbol().isEmpty()) {
                return q.getSymbol();
            }
        }
        return "";
    }

    /**
     * 按指称的模式解析取值。
     *
     * @throws NumberFormatException 文本不是该模式的合法指称
     */
    public static Value value(Node p) {
        Mode m = p.getMode();
        String t = text(p);
        if (m == Mode.INT) {
            return Value.ofInt(Long.parseLong(t.trim()));
        } else if (m == Mode.REAL) {
            return Value.ofReal(parseReal(t));
        } else if (m == Mode.BOOL) {
            return Value.ofBool(parseBool(t));
        } else if (m == Mode.CHAR) {
            return Value.ofChar(t.isEmpty() ? 0 : t.charAt(0) & 0xff);
        } else if (m == Mode.BITS) {
            return Value.ofBits(parseBits(t));
        } else if (m != null && m.isLong()) {
            return Value.ofLong(m, new BigDecimal(normaliseReal(t)));
        }
        throw new NumberFormatException("不能解析 " + m + " 指称: " + t);
    }

    /** 空格分隔、以 \ 或 e 表示指数的实数指称 */
    public static double parseReal(String t) {
        return Double.parseDouble(normaliseReal(t));
    }

    private static String normaliseReal(String t) {
        String s = t.replace(" ", "").replace('\\', 'e').toLowerCase(Locale.ROOT);
        if (s.startsWith(".")) {
            s = "0" + s;
        }
        return s;
    }

    public static boolean parseBool(String t) {
        String s = t.trim().toUpperCase(Locale.ROOT);
        if (s.equals("TRUE")) {
            return true;
        } else if (s.equals("FALSE")) {
            return false;
        }
        throw new NumberFormatException("不是 BOOL 指称: " + t);
    }

    /** 形如 {@code 16r00ff} 或 {@code 2r101} 的位串指称 */
    public static long parseBits(String t) {
        String s = t.replace(" ", "").toLowerCase(Locale.ROOT);
        int r = s.indexOf('r');
        if (r <= 0) {
            throw new NumberFormatException("不是 BITS 指称: " + t);
        }
        int radix = Integer.parseInt(s.substring(0, r));
        if (radix != 2 && radix != 4 && radix != 8 && radix != 16) {
            throw new NumberFormatException("BITS 指称的基数无效: " + t);
        }
        return Long.parseUnsignedLong(s.substring(r + 1), radix);
    }

    /** 实数指称在 C 中的写法：没有小数点和指数时加强制转换 */
    public static String realCode(String t) {
        String s = t.replace(" ", "").replace('\\', 'e');
        if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
            return "(REAL_T) " + s;
        }
        return s;
    }
}
