package com.a68g.optimiser.primitive;

import com.a68g.syntax.Mode;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 暂存栈上的一个值。COMPLEX 以一对 REAL 存放，LONG 模式以 {@link BigDecimal} 存放。
 */
public final class Value {
    private final Mode mode;
    private final long bits;
    private final double re;
    private final double im;
    private final BigDecimal mp;

    private Value(Mode mode, long bits, double re, double im, BigDecimal mp) {
        this.mode = mode;
        this.bits = bits;
        this.re = re;
        this.im = im;
        this.mp = mp;
    }

    public static Value ofInt(long v) {
        return new Value(Mode.INT, v, 0, 0, null);
    }

    public static Value ofReal(double v) {
        return new Value(Mode.REAL, 0, v, 0, null);
    }

    public static Value ofBool(boolean v) {
        return new Value(Mode.BOOL, v ? 1 : 0, 0, 0, null);
    }

    public static Value ofChar(int v) {
        return new Value(Mode.CHAR, v, 0, 0, null);
    }

    public static Value ofBits(long v) {
        return new Value(Mode.BITS, v, 0, 0, null);
    }

    public static Value ofComplex(double re, double im) {
        return new Value(Mode.COMPLEX, 0, re, im, null);
    }

    public static Value ofLong(Mode mode, BigDecimal v) {
        if (!mode.isLong()) {
            throw new IllegalArgumentException("不是多精度模式: " + mode);
        }
        return new Value(mode, 0, 0, 0, Objects.requireNonNull(v));
    }

    /** 指定模式的零值 */
    public static Value zero(Mode mode) {
        if (mode == Mode.REAL) return ofReal(0.0);
        if (mode == Mode.BOOL) return ofBool(false);
        if (mode == Mode.CHAR) return ofChar(0);
        if (mode == Mode.BITS) return ofBits(0);
        if (mode == Mode.COMPLEX) return ofComplex(0.0, 0.0);
        if (mode != null && mode.isLong()) return ofLong(mode, BigDecimal.ZERO);
        return ofInt(0);
    }

    public Mode getMode() { return mode; }

    public long asInt() { return bits; }
    public double asReal() { return re; }
    public boolean asBool() { return bits != 0; }
    public int asChar() { return (int) bits; }
    public long asBits() { return bits; }
    public double re() { return re; }
    public double im() { return im; }
    public BigDecimal asLong() { return mp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value v = (Value) o;
        return mode == v.mode && bits == v.bits
                && Double.compare(re, v.re) == 0 && Double.compare(im, v.im) == 0
                && (mp == null ? v.mp == null : v.mp != null && mp.compareTo(v.mp) == 0);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, bits, re, im, mp != null ? mp.stripTrailingZeros() : null);
    }

    @Override
    public String toString() {
        if (mode == Mode.REAL) return Double.toString(re);
        if (mode == Mode.BOOL) return asBool() ? "TRUE" : "FALSE";
        if (mode == Mode.CHAR) return "'" + (char) bits + "'";
        if (mode == Mode.BITS) return "0x" + Long.toHexString(bits);
        if (mode == Mode.COMPLEX) return "(" + re + ", " + im + ")";
        if (mp != null) return mp.toPlainString();
        return Long.toString(bits);
    }
}
