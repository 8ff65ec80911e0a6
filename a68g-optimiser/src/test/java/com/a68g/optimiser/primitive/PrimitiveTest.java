package com.a68g.optimiser.primitive;

import com.a68g.syntax.Mode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Primitive 单元测试
 */
class PrimitiveTest {

    /** 在新栈上对两个操作数重放原语 */
    private static Value apply(Primitive prim, Value a, Value b) {
        ScratchStack s = new ScratchStack();
        s.push(a);
        s.push(b);
        prim.evaluate(s);
        Value v = s.pop();
        assertTrue(s.isEmpty());
        return v;
    }

    // ================================================================
    // 查找
    // ================================================================

    @Nested
    @DisplayName("原语表查找")
    class LookupTests {

        @Test
        @DisplayName("按种类与身份查找")
        void lookup() {
            assertEquals(Primitive.ADD_INT, Primitive.lookup(Primitive.Kind.DYADIC, "genie_add_int"));
            assertEquals(Primitive.SQRT_REAL, Primitive.lookup(Primitive.Kind.FUNCTION, "genie_sqrt_real"));
            assertEquals(Primitive.PI, Primitive.lookup(Primitive.Kind.CONSTANT, "genie_pi"));
        }

        @Test
        @DisplayName("种类不同或未收录时返回 null")
        void missing() {
            assertNull(Primitive.lookup(Primitive.Kind.MONADIC, "genie_add_int"));
            assertNull(Primitive.lookup(Primitive.Kind.FUNCTION, "genie_whole"));
            assertNull(Primitive.lookup(Primitive.Kind.DYADIC, null));
        }

        @Test
        @DisplayName("检查模式使用带溢出检查的文本")
        void checkCode() {
            assertEquals("+", Primitive.ADD_INT.code(false));
            assertEquals("a68g_add_int", Primitive.ADD_INT.code(true));
            assertFalse(Primitive.ADD_INT.isFunctionLike(false));
            assertTrue(Primitive.ADD_INT.isFunctionLike(true));
            assertEquals("<", Primitive.LT_INT.code(true));
        }

        @Test
        @DisplayName("LONG 原语与不可折叠原语")
        void flags() {
            assertTrue(Primitive.ADD_LONG_INT.isLong());
            assertFalse(Primitive.ADD_INT.isLong());
            assertNull(Primitive.LONG_MAX_INT.code(false));
            assertFalse(Primitive.PLUSAB_INT.isFoldable());
            assertThrows(IllegalStateException.class, () -> Primitive.PLUSAB_INT.evaluate(new ScratchStack()));
        }
    }

    // ================================================================
    // 求值
    // ================================================================

    @Nested
    @DisplayName("求值")
    class EvaluateTests {

        @Test
        @DisplayName("整数运算")
        void intArithmetic() {
            assertEquals(Value.ofInt(5), apply(Primitive.ADD_INT, Value.ofInt(2), Value.ofInt(3)));
            assertEquals(Value.ofInt(-1), apply(Primitive.SUB_INT, Value.ofInt(2), Value.ofInt(3)));
            assertEquals(Value.ofInt(2), apply(Primitive.MOD_INT, Value.ofInt(-7), Value.ofInt(3)));
            assertEquals(Value.ofReal(0.5), apply(Primitive.DIV_INT, Value.ofInt(1), Value.ofInt(2)));
        }

        @Test
        @DisplayName("整数溢出抛出 ArithmeticException")
        void intOverflow() {
            assertThrows(ArithmeticException.class,
                    () -> apply(Primitive.ADD_INT, Value.ofInt(Long.MAX_VALUE), Value.ofInt(1)));
            assertThrows(ArithmeticException.class,
                    () -> apply(Primitive.DIV_INT, Value.ofInt(1), Value.ofInt(0)));
        }

        @Test
        @DisplayName("最小整数除以 -1 溢出")
        void overIntOverflow() {
            assertThrows(ArithmeticException.class,
                    () -> apply(Primitive.OVER_INT, Value.ofInt(Long.MIN_VALUE), Value.ofInt(-1)));
            assertEquals(Value.ofInt(Long.MIN_VALUE / 2),
                    apply(Primitive.OVER_INT, Value.ofInt(Long.MIN_VALUE), Value.ofInt(2)));
        }

        @Test
        @DisplayName("比较得到 BOOL")
        void comparisons() {
            assertEquals(Value.ofBool(true), apply(Primitive.LT_INT, Value.ofInt(1), Value.ofInt(2)));
            assertEquals(Value.ofBool(false), apply(Primitive.GE_REAL, Value.ofReal(1.0), Value.ofReal(2.0)));
        }

        @Test
        @DisplayName("位运算与移位")
        void bits() {
            assertEquals(Value.ofBits(0x0f), apply(Primitive.AND_BITS, Value.ofBits(0xff), Value.ofBits(0x0f)));
            assertEquals(Value.ofBits(0x10), apply(Primitive.SHL_BITS, Value.ofBits(1), Value.ofInt(4)));
            assertEquals(Value.ofBits(0), apply(Primitive.SHL_BITS, Value.ofBits(1), Value.ofInt(64)));
        }

        @Test
        @DisplayName("复数由两个 REAL 或一个 COMPLEX 组成")
        void complex() {
            ScratchStack s = new ScratchStack();
            s.push(Value.ofReal(1.0));
            s.push(Value.ofReal(2.0));
            s.push(Value.ofComplex(3.0, 4.0));
            Primitive.ADD_COMPLEX.evaluate(s);
            assertEquals(Value.ofComplex(4.0, 6.0), s.pop());
        }

        @Test
        @DisplayName("单目运算")
        void monadic() {
            ScratchStack s = new ScratchStack();
            s.push(Value.ofReal(2.5));
            Primitive.ROUND_REAL.evaluate(s);
            assertEquals(Value.ofInt(3), s.pop());
            s.push(Value.ofInt(300));
            assertThrows(ArithmeticException.class, () -> Primitive.REPR_CHAR.evaluate(s));
        }

        @Test
        @DisplayName("多精度加法保留 LONG 模式")
        void longAdd() {
            Value v = apply(Primitive.ADD_LONG_INT,
                    Value.ofLong(Mode.LONG_INT, new BigDecimal("99999999999999999999")),
                    Value.ofLong(Mode.LONG_INT, BigDecimal.ONE));
            assertEquals(Mode.LONG_INT, v.getMode());
            assertEquals(0, new BigDecimal("100000000000000000000").compareTo(v.asLong()));
        }
    }
}
