package com.a68g.optimiser.fold;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MultiPrecision 单元测试
 */
class MultiPrecisionTest {

    @Test
    @DisplayName("大整数拆成 10^7 进制数位")
    void largeInteger() {
        MultiPrecision mp = MultiPrecision.of(new BigDecimal("12345678901234567890"));
        assertEquals(2, mp.getExponent());
        assertArrayEquals(new long[]{123456, 7890123, 4567890, 0, 0, 0}, mp.getDigits());
        assertEquals("INIT_MASK, 2, 123456, 7890123, 4567890, 0, 0, 0", mp.initialiser());
    }

    @Test
    @DisplayName("小数的指数为负")
    void fraction() {
        MultiPrecision mp = MultiPrecision.of(new BigDecimal("0.5"));
        assertEquals(-1, mp.getExponent());
        assertEquals("INIT_MASK, -1, 5000000, 0, 0, 0, 0, 0", mp.initialiser());
    }

    @Test
    @DisplayName("符号记在第一个数位上")
    void negative() {
        MultiPrecision mp = MultiPrecision.of(new BigDecimal("-42"));
        assertEquals(-42, mp.getDigits()[0]);
        assertEquals(0, new BigDecimal("-42").compareTo(mp.toBigDecimal()));
    }

    @Test
    @DisplayName("零")
    void zero() {
        MultiPrecision mp = MultiPrecision.of(BigDecimal.ZERO);
        assertEquals(0, mp.getExponent());
        assertEquals(0, BigDecimal.ZERO.compareTo(mp.toBigDecimal()));
    }

    @Test
    @DisplayName("数位能还原原值")
    void restores() {
        BigDecimal v = new BigDecimal("31415926.53589793");
        assertEquals(0, v.compareTo(MultiPrecision.of(v).toBigDecimal()));
    }
}
