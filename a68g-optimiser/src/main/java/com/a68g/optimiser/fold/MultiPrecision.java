package com.a68g.optimiser.fold;

import com.a68g.syntax.Mode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * LONG 模式的多精度数位表示。
 * <p>
 * 值 = sign * sum(d[i] * RADIX^(exponent - i))，i 从 0 开始；
 * 各数位在 [0, RADIX) 内，符号记在第一个数位上，与运行时的 MP_DIGIT_T 数组布局一致。
 */
public final class MultiPrecision {

    public static final int RADIX_DIGITS = 7;
    public static final BigDecimal RADIX = BigDecimal.TEN.pow(RADIX_DIGITS);

    private final int exponent;
    private final long[] digits;

    private MultiPrecision(int exponent, long[] digits) {
        this.exponent = exponent;
        this.digits = digits;
    }

    /** 截断到 {@link Mode#LONG_MP_DIGITS} 个数位 */
    public static MultiPrecision of(BigDecimal value) {
        long[] d = new long[Mode.LONG_MP_DIGITS];
        if (value.signum() == 0) {
            return new MultiPrecision(0, d);
        }
        BigDecimal a = value.abs();
        int decimalExponent = a.precision() - a.scale() - 1;
        int e = Math.floorDiv(decimalExponent, RADIX_DIGITS);
        BigDecimal scaled = a.movePointLeft(RADIX_DIGITS * e);
        for (int i = 0; i < d.length; i++) {
            BigDecimal whole = scaled.setScale(0, RoundingMode.DOWN);
            d[i] = whole.longValueExact();
            scaled = scaled.subtract(whole).movePointRight(RADIX_DIGITS);
        }
        if (value.signum() < 0) {
            d[0] = -d[0];
        }
        return new MultiPrecision(e, d);
    }

    public int getExponent() {
        return exponent;
    }

    public long[] getDigits() {
        return digits.clone();
    }

    /** 还原为十进制值 */
    public BigDecimal toBigDecimal() {
        BigDecimal sum = BigDecimal.ZERO;
        boolean negative = digits[0] < 0;
        for (int i = 0; i < digits.length; i++) {
            long d = i == 0 ? Math.abs(digits[0]) : digits[i];
            sum = sum.add(BigDecimal.valueOf(d).movePointRight(RADIX_DIGITS * (exponent - i)));
        }
        return negative ? sum.negate() : sum;
    }

    /** C 初始化列表的内容：{@code INIT_MASK, exponent, d1, ..., d6} */
    public String initialiser() {
        StringBuilder sb = new StringBuilder("INIT_MASK, ").append(exponent);
        for (long d : digits) {
            sb.append(", ").append(d);
        }
        return sb.toString();
    }
}
