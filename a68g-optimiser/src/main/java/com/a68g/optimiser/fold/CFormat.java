package com.a68g.optimiser.fold;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * 按 C 语言 printf 的规则格式化字面量。
 * <p>
 * {@link String#format} 的 {@code %g} 不去掉尾随零、指数格式也不同，
 * 生成的 C 文本需要与运行时库的输出一致，所以这里单独实现。
 */
public final class CFormat {

    /** REAL 字面量的有效位数（REAL_WIDTH + 2） */
    public static final int REAL_DIGITS = 17;

    private CFormat() {
    }

    /**
     * C 的 {@code %.<precision>g}。
     */
    public static String g(double x, int precision) {
        if (Double.isNaN(x)) {
            return "nan";
        }
        if (Double.isInfinite(x)) {
            return x > 0 ? "inf" : "-inf";
        }
        if (x == 0.0) {
            return (1.0 / x) < 0 ? "-0" : "0";
        }
        int p = Math.max(precision, 1);
        BigDecimal d = new BigDecimal(x).round(new MathContext(p, RoundingMode.HALF_EVEN));
        int exp = d.precision() - d.scale() - 1;
        StringBuilder digits = new StringBuilder(d.unscaledValue().abs().toString());
        while (digits.length() < p) {
            digits.append('0');
        }
        String sign = d.signum() < 0 ? "-" : "";
        if (exp < -4 || exp >= p) {
            String mantissa = stripZeros(digits.substring(0, 1), digits.substring(1));
            String e = Integer.toString(Math.abs(exp));
            if (e.length() < 2) {
                e = "0" + e;
            }
            return sign + mantissa + "e" + (exp < 0 ? "-" : "+") + e;
        }
        if (exp >= 0) {
            return sign + stripZeros(digits.substring(0, exp + 1), digits.substring(exp + 1));
        }
        return sign + stripZeros("0", "0".repeat(-exp - 1) + digits);
    }

    private static String stripZeros(String whole, String fraction) {
        int end = fraction.length();
        while (end > 0 && fraction.charAt(end - 1) == '0') {
            end--;
        }
        return end == 0 ? whole : whole + "." + fraction.substring(0, end);
    }

    /** REAL 值的 {@code %.17g} 文本 */
    public static String real(double x) {
        return g(x, REAL_DIGITS);
    }

    /** 十六进制，等同 {@code %lx} */
    public static String hex(long x) {
        return Long.toHexString(x);
    }

    /** BITS 字面量 */
    public static String bits(long x) {
        return "(UNSIGNED_T) 0x" + hex(x);
    }

    /** CHAR 字面量 */
    public static String character(int c) {
        if (c == '\'') {
            return "'\\''";
        } else if (c == '\\') {
            return "'\\\\'";
        } else if (c == 0) {
            return "NULL_CHAR";
        } else if (c >= 32 && c < 127) {
            return "'" + (char) c + "'";
        }
        return "(CHAR_T) " + c;
    }

    /** BOOL 字面量 */
    public static String bool(boolean b) {
        return b ? "A68_TRUE" : "A68_FALSE";
    }
}
