package com.a68g.optimiser.primitive;

import com.a68g.syntax.Mode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * 可编译的解释器原语。
 * <p>
 * 每个条目把解释器原语的身份（{@code Tag#getProcedure()}，如 {@code genie_add_int}）
 * 映射到生成代码中的 C 文本，并带有在折叠栈上重放该原语的求值函数。
 * 求值函数为 null 的原语可以编译，但不参与常量折叠。
 * 运行时检查模式下，部分 INT 运算使用带溢出检查的文本。
 */
public enum Primitive {

    // ============ 单目运算 ============

    MINUS_INT(Kind.MONADIC, "genie_minus_int", "-", s -> s.push(Value.ofInt(Math.negateExact(s.popInt())))),
    MINUS_REAL(Kind.MONADIC, "genie_minus_real", "-", s -> s.push(Value.ofReal(-s.popReal()))),
    ABS_INT(Kind.MONADIC, "genie_abs_int", "labs", s -> s.push(Value.ofInt(Math.absExact(s.popInt())))),
    ABS_REAL(Kind.MONADIC, "genie_abs_real", "fabs", s -> s.push(Value.ofReal(Math.abs(s.popReal())))),
    SIGN_INT(Kind.MONADIC, "genie_sign_int", "SIGN", s -> s.push(Value.ofInt(Long.signum(s.popInt())))),
    SIGN_REAL(Kind.MONADIC, "genie_sign_real", "SIGN", s -> s.push(Value.ofInt((long) Math.signum(s.popReal())))),
    ENTIER_REAL(Kind.MONADIC, "genie_entier_real", "a68g_entier", s -> s.push(Value.ofInt(toInt(Math.floor(s.popReal()))))),
    ROUND_REAL(Kind.MONADIC, "genie_round_real", "a68g_round", s -> s.push(Value.ofInt(toInt(round(s.popReal()))))),
    NOT_BOOL(Kind.MONADIC, "genie_not_bool", "!", s -> s.push(Value.ofBool(!s.popBool()))),
    ABS_BOOL(Kind.MONADIC, "genie_abs_bool", "(int) ", s -> s.push(Value.ofInt(s.popBool() ? 1 : 0))),
    ABS_BITS(Kind.MONADIC, "genie_abs_bits", "(int) ", s -> s.push(Value.ofInt(s.popBits()))),
    BIN_INT(Kind.MONADIC, "genie_bin_int", "(unsigned) ", s -> s.push(Value.ofBits(s.popInt()))),
    NOT_BITS(Kind.MONADIC, "genie_not_bits", "~", s -> s.push(Value.ofBits(~s.popBits()))),
    ABS_CHAR(Kind.MONADIC, "genie_abs_char", "TO_UCHAR", s -> s.push(Value.ofInt(s.popChar() & 0xff))),
    REPR_CHAR(Kind.MONADIC, "genie_repr_char", "", s -> s.push(Value.ofChar(toChar(s.popInt())))),
    RE_COMPLEX(Kind.MONADIC, "genie_re_complex", "a68g_re_complex", s -> s.push(Value.ofReal(s.popComplex().re()))),
    IM_COMPLEX(Kind.MONADIC, "genie_im_complex", "a68g_im_complex", s -> s.push(Value.ofReal(s.popComplex().im()))),
    MINUS_COMPLEX(Kind.MONADIC, "genie_minus_complex", "a68g_minus_complex", s -> {
        Value z = s.popComplex();
        s.push(Value.ofComplex(-z.re(), -z.im()));
    }),
    ABS_COMPLEX(Kind.MONADIC, "genie_abs_complex", "a68g_abs_complex", s -> {
        Value z = s.popComplex();
        s.push(Value.ofReal(Math.hypot(z.re(), z.im())));
    }),
    ARG_COMPLEX(Kind.MONADIC, "genie_arg_complex", "a68g_arg_complex", s -> {
        Value z = s.popComplex();
        if (z.re() == 0.0 && z.im() == 0.0) {
            throw new ArithmeticException("ARG of zero");
        }
        s.push(Value.ofReal(Math.atan2(z.im(), z.re())));
    }),
    CONJ_COMPLEX(Kind.MONADIC, "genie_conj_complex", "a68g_conj_complex", s -> {
        Value z = s.popComplex();
        s.push(Value.ofComplex(z.re(), -z.im()));
    }),
    ROUND_LONG_MP(Kind.MONADIC, "genie_round_long_mp", "(void) round_mp", true,
            s -> s.push(Value.ofLong(Mode.LONG_INT, s.popLong().setScale(0, RoundingMode.HALF_UP)))),
    ENTIER_LONG_MP(Kind.MONADIC, "genie_entier_long_mp", "(void) entier_mp", true,
            s -> s.push(Value.ofLong(Mode.LONG_INT, s.popLong().setScale(0, RoundingMode.FLOOR)))),
    MINUS_LONG_MP(Kind.MONADIC, "genie_minus_long_mp", "(void) minus_mp", true, s -> {
        Value v = s.pop();
        s.push(Value.ofLong(v.getMode(), v.asLong().negate()));
    }),
    ABS_LONG_MP(Kind.MONADIC, "genie_abs_long_mp", "(void) abs_mp", true, s -> {
        Value v = s.pop();
        s.push(Value.ofLong(v.getMode(), v.asLong().abs()));
    }),
    IDLE(Kind.MONADIC, "genie_idle", "", s -> s.push(s.pop())),

    // ============ 双目运算 ============

    ADD_INT(Kind.DYADIC, "genie_add_int", "+", "a68g_add_int", intOp(Math::addExact)),
    SUB_INT(Kind.DYADIC, "genie_sub_int", "-", "a68g_sub_int", intOp(Math::subtractExact)),
    MUL_INT(Kind.DYADIC, "genie_mul_int", "*", "a68g_mul_int", intOp(Math::multiplyExact)),
    OVER_INT(Kind.DYADIC, "genie_over_int", "/", "a68g_over_int", intOp(Primitive::overInt)),
    MOD_INT(Kind.DYADIC, "genie_mod_int", "a68g_mod_int", "a68g_mod_int", intOp(Primitive::mod)),
    DIV_INT(Kind.DYADIC, "genie_div_int", "DIV_INT", "a68g_div_int", s -> {
        long b = s.popInt();
        long a = s.popInt();
        if (b == 0) {
            throw new ArithmeticException("division by zero");
        }
        s.push(Value.ofReal((double) a / (double) b));
    }),
    EQ_INT(Kind.DYADIC, "genie_eq_int", "==", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() == b)); }),
    NE_INT(Kind.DYADIC, "genie_ne_int", "!=", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() != b)); }),
    LT_INT(Kind.DYADIC, "genie_lt_int", "<", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() < b)); }),
    GT_INT(Kind.DYADIC, "genie_gt_int", ">", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() > b)); }),
    LE_INT(Kind.DYADIC, "genie_le_int", "<=", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() <= b)); }),
    GE_INT(Kind.DYADIC, "genie_ge_int", ">=", s -> { long b = s.popInt(); s.push(Value.ofBool(s.popInt() >= b)); }),
    PLUSAB_INT(Kind.DYADIC, "genie_plusab_int", "a68g_plusab_int", null),
    MINUSAB_INT(Kind.DYADIC, "genie_minusab_int", "a68g_minusab_int", null),
    TIMESAB_INT(Kind.DYADIC, "genie_timesab_int", "a68g_timesab_int", null),
    OVERAB_INT(Kind.DYADIC, "genie_overab_int", "a68g_overab_int", null),
    ADD_REAL(Kind.DYADIC, "genie_add_real", "+", realOp((a, b) -> a + b)),
    SUB_REAL(Kind.DYADIC, "genie_sub_real", "-", realOp((a, b) -> a - b)),
    MUL_REAL(Kind.DYADIC, "genie_mul_real", "*", realOp((a, b) -> a * b)),
    DIV_REAL(Kind.DYADIC, "genie_div_real", "/", realOp((a, b) -> {
        if (b == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return a / b;
    })),
    POW_REAL(Kind.DYADIC, "genie_pow_real", "a68g_pow_real", realOp(Math::pow)),
    POW_REAL_INT(Kind.DYADIC, "genie_pow_real_int", "a68g_pow_real_int", s -> {
        long n = s.popInt();
        s.push(Value.ofReal(Math.pow(s.popReal(), n)));
    }),
    EQ_REAL(Kind.DYADIC, "genie_eq_real", "==", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() == b)); }),
    NE_REAL(Kind.DYADIC, "genie_ne_real", "!=", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() != b)); }),
    LT_REAL(Kind.DYADIC, "genie_lt_real", "<", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() < b)); }),
    GT_REAL(Kind.DYADIC, "genie_gt_real", ">", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() > b)); }),
    LE_REAL(Kind.DYADIC, "genie_le_real", "<=", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() <= b)); }),
    GE_REAL(Kind.DYADIC, "genie_ge_real", ">=", s -> { double b = s.popReal(); s.push(Value.ofBool(s.popReal() >= b)); }),
    PLUSAB_REAL(Kind.DYADIC, "genie_plusab_real", "a68g_plusab_real", null),
    MINUSAB_REAL(Kind.DYADIC, "genie_minusab_real", "a68g_minusab_real", null),
    TIMESAB_REAL(Kind.DYADIC, "genie_timesab_real", "a68g_timesab_real", null),
    DIVAB_REAL(Kind.DYADIC, "genie_divab_real", "a68g_divab_real", null),
    EQ_CHAR(Kind.DYADIC, "genie_eq_char", "==", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() == b)); }),
    NE_CHAR(Kind.DYADIC, "genie_ne_char", "!=", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() != b)); }),
    LT_CHAR(Kind.DYADIC, "genie_lt_char", "<", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() < b)); }),
    GT_CHAR(Kind.DYADIC, "genie_gt_char", ">", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() > b)); }),
    LE_CHAR(Kind.DYADIC, "genie_le_char", "<=", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() <= b)); }),
    GE_CHAR(Kind.DYADIC, "genie_ge_char", ">=", s -> { int b = s.popChar(); s.push(Value.ofBool(s.popChar() >= b)); }),
    EQ_BOOL(Kind.DYADIC, "genie_eq_bool", "==", s -> { boolean b = s.popBool(); s.push(Value.ofBool(s.popBool() == b)); }),
    NE_BOOL(Kind.DYADIC, "genie_ne_bool", "!=", s -> { boolean b = s.popBool(); s.push(Value.ofBool(s.popBool() != b)); }),
    AND_BOOL(Kind.DYADIC, "genie_and_bool", "&&", s -> { boolean b = s.popBool(); s.push(Value.ofBool(s.popBool() & b)); }),
    OR_BOOL(Kind.DYADIC, "genie_or_bool", "||", s -> { boolean b = s.popBool(); s.push(Value.ofBool(s.popBool() | b)); }),
    AND_BITS(Kind.DYADIC, "genie_and_bits", "&", s -> { long b = s.popBits(); s.push(Value.ofBits(s.popBits() & b)); }),
    OR_BITS(Kind.DYADIC, "genie_or_bits", "|", s -> { long b = s.popBits(); s.push(Value.ofBits(s.popBits() | b)); }),
    EQ_BITS(Kind.DYADIC, "genie_eq_bits", "==", s -> { long b = s.popBits(); s.push(Value.ofBool(s.popBits() == b)); }),
    NE_BITS(Kind.DYADIC, "genie_ne_bits", "!=", s -> { long b = s.popBits(); s.push(Value.ofBool(s.popBits() != b)); }),
    SHL_BITS(Kind.DYADIC, "genie_shl_bits", "<<", s -> { long n = s.popInt(); s.push(Value.ofBits(shift(s.popBits(), n))); }),
    SHR_BITS(Kind.DYADIC, "genie_shr_bits", ">>", s -> { long n = s.popInt(); s.push(Value.ofBits(shift(s.popBits(), -n))); }),
    I_COMPLEX(Kind.DYADIC, "genie_icomplex", "a68g_i_complex", s -> {
        double im = s.popReal();
        s.push(Value.ofComplex(s.popReal(), im));
    }),
    IINT_COMPLEX(Kind.DYADIC, "genie_iint_complex", "a68g_i_complex", s -> {
        long im = s.popInt();
        s.push(Value.ofComplex(s.popInt(), im));
    }),
    ADD_COMPLEX(Kind.DYADIC, "genie_add_complex", "a68g_add_complex", complexOp(Primitive::complexAdd)),
    SUB_COMPLEX(Kind.DYADIC, "genie_sub_complex", "a68g_sub_complex", complexOp(Primitive::complexSub)),
    MUL_COMPLEX(Kind.DYADIC, "genie_mul_complex", "a68g_mul_complex", complexOp(Primitive::complexMul)),
    DIV_COMPLEX(Kind.DYADIC, "genie_div_complex", "a68g_div_complex", complexOp(Primitive::complexDiv)),
    EQ_COMPLEX(Kind.DYADIC, "genie_eq_complex", "a68g_eq_complex", s -> {
        Value b = s.popComplex();
        Value a = s.popComplex();
        s.push(Value.ofBool(a.re() == b.re() && a.im() == b.im()));
    }),
    NE_COMPLEX(Kind.DYADIC, "genie_ne_complex", "a68g_ne_complex", s -> {
        Value b = s.popComplex();
        Value a = s.popComplex();
        s.push(Value.ofBool(a.re() != b.re() || a.im() != b.im()));
    }),
    ADD_LONG_INT(Kind.DYADIC, "genie_add_long_int", "(void) add_mp", true, mpOp(Mode.LONG_INT, BigDecimal::add)),
    ADD_LONG_MP(Kind.DYADIC, "genie_add_long_mp", "(void) add_mp", true, mpOp(Mode.LONG_REAL, BigDecimal::add)),
    SUB_LONG_INT(Kind.DYADIC, "genie_sub_long_int", "(void) sub_mp", true, mpOp(Mode.LONG_INT, BigDecimal::subtract)),
    SUB_LONG_MP(Kind.DYADIC, "genie_sub_long_mp", "(void) sub_mp", true, mpOp(Mode.LONG_REAL, BigDecimal::subtract)),
    MUL_LONG_INT(Kind.DYADIC, "genie_mul_long_int", "(void) mul_mp", true, mpOp(Mode.LONG_INT, BigDecimal::multiply)),
    MUL_LONG_MP(Kind.DYADIC, "genie_mul_long_mp", "(void) mul_mp", true, mpOp(Mode.LONG_REAL, BigDecimal::multiply)),
    OVER_LONG_MP(Kind.DYADIC, "genie_over_long_mp", "(void) over_mp", true, mpOp(Mode.LONG_INT, BigDecimal::divideToIntegralValue)),
    DIV_LONG_MP(Kind.DYADIC, "genie_div_long_mp", "(void) div_mp", true, mpOp(Mode.LONG_REAL, BigDecimal::divide)),
    EQ_LONG_MP(Kind.DYADIC, "genie_eq_long_mp", "eq_mp", true, mpCompare(c -> c == 0)),
    NE_LONG_MP(Kind.DYADIC, "genie_ne_long_mp", "ne_mp", true, mpCompare(c -> c != 0)),
    LT_LONG_MP(Kind.DYADIC, "genie_lt_long_mp", "lt_mp", true, mpCompare(c -> c < 0)),
    LE_LONG_MP(Kind.DYADIC, "genie_le_long_mp", "le_mp", true, mpCompare(c -> c <= 0)),
    GT_LONG_MP(Kind.DYADIC, "genie_gt_long_mp", "gt_mp", true, mpCompare(c -> c > 0)),
    GE_LONG_MP(Kind.DYADIC, "genie_ge_long_mp", "ge_mp", true, mpCompare(c -> c >= 0)),

    // ============ 标准函数 ============

    SQRT_REAL(Kind.FUNCTION, "genie_sqrt_real", "sqrt", realFunction(Math::sqrt)),
    CURT_REAL(Kind.FUNCTION, "genie_curt_real", "curt", realFunction(Math::cbrt)),
    EXP_REAL(Kind.FUNCTION, "genie_exp_real", "a68g_exp", realFunction(Math::exp)),
    LN_REAL(Kind.FUNCTION, "genie_ln_real", "log", realFunction(Math::log)),
    LOG_REAL(Kind.FUNCTION, "genie_log_real", "log10", realFunction(Math::log10)),
    SIN_REAL(Kind.FUNCTION, "genie_sin_real", "sin", realFunction(Math::sin)),
    COS_REAL(Kind.FUNCTION, "genie_cos_real", "cos", realFunction(Math::cos)),
    TAN_REAL(Kind.FUNCTION, "genie_tan_real", "tan", realFunction(Math::tan)),
    ARCSIN_REAL(Kind.FUNCTION, "genie_arcsin_real", "asin", realFunction(Math::asin)),
    ARCCOS_REAL(Kind.FUNCTION, "genie_arccos_real", "acos", realFunction(Math::acos)),
    ARCTAN_REAL(Kind.FUNCTION, "genie_arctan_real", "atan", realFunction(Math::atan)),
    SINH_REAL(Kind.FUNCTION, "genie_sinh_real", "sinh", realFunction(Math::sinh)),
    COSH_REAL(Kind.FUNCTION, "genie_cosh_real", "cosh", realFunction(Math::cosh)),
    TANH_REAL(Kind.FUNCTION, "genie_tanh_real", "tanh", realFunction(Math::tanh)),
    ARCSINH_REAL(Kind.FUNCTION, "genie_arcsinh_real", "a68g_asinh",
            realFunction(x -> Math.log(x + Math.sqrt(x * x + 1.0)))),
    ARCCOSH_REAL(Kind.FUNCTION, "genie_arccosh_real", "a68g_acosh",
            realFunction(x -> Math.log(x + Math.sqrt(x * x - 1.0)))),
    ARCTANH_REAL(Kind.FUNCTION, "genie_arctanh_real", "a68g_atanh",
            realFunction(x -> 0.5 * Math.log((1.0 + x) / (1.0 - x)))),
    INVERF_REAL(Kind.FUNCTION, "genie_inverf_real", "inverf", null),
    INVERFC_REAL(Kind.FUNCTION, "genie_inverfc_real", "inverfc", null),
    SQRT_COMPLEX(Kind.FUNCTION, "genie_sqrt_complex", "a68g_sqrt_complex", complexFunction(Primitive::complexSqrt)),
    EXP_COMPLEX(Kind.FUNCTION, "genie_exp_complex", "a68g_exp_complex", complexFunction(Primitive::complexExp)),
    LN_COMPLEX(Kind.FUNCTION, "genie_ln_complex", "a68g_ln_complex", complexFunction(Primitive::complexLn)),
    SIN_COMPLEX(Kind.FUNCTION, "genie_sin_complex", "a68g_sin_complex", complexFunction(Primitive::complexSin)),
    COS_COMPLEX(Kind.FUNCTION, "genie_cos_complex", "a68g_cos_complex", complexFunction(Primitive::complexCos)),
    TAN_COMPLEX(Kind.FUNCTION, "genie_tan_complex", "a68g_tan_complex", complexFunction(
            z -> complexDiv(complexSin(z), complexCos(z)))),
    ARCSIN_COMPLEX(Kind.FUNCTION, "genie_arcsin_complex", "a68g_arcsin_complex", null),
    ARCCOS_COMPLEX(Kind.FUNCTION, "genie_arccos_complex", "a68g_arccos_complex", null),
    ARCTAN_COMPLEX(Kind.FUNCTION, "genie_arctan_complex", "a68g_arctan_complex", null),
    SQRT_LONG_MP(Kind.FUNCTION, "genie_sqrt_long_mp", "(void) sqrt_mp", true,
            s -> s.push(Value.ofLong(Mode.LONG_REAL, s.popLong().sqrt(Precision.MP_CONTEXT)))),
    EXP_LONG_MP(Kind.FUNCTION, "genie_exp_long_mp", "(void) exp_mp", true, null),
    LN_LONG_MP(Kind.FUNCTION, "genie_ln_long_mp", "(void) ln_mp", true, null),
    LOG_LONG_MP(Kind.FUNCTION, "genie_log_long_mp", "(void) log_mp", true, null),
    SIN_LONG_MP(Kind.FUNCTION, "genie_sin_long_mp", "(void) sin_mp", true, null),
    COS_LONG_MP(Kind.FUNCTION, "genie_cos_long_mp", "(void) cos_mp", true, null),
    TAN_LONG_MP(Kind.FUNCTION, "genie_tan_long_mp", "(void) tan_mp", true, null),
    ARCSIN_LONG_MP(Kind.FUNCTION, "genie_asin_long_mp", "(void) asin_mp", true, null),
    ARCCOS_LONG_MP(Kind.FUNCTION, "genie_acos_long_mp", "(void) acos_mp", true, null),
    ARCTAN_LONG_MP(Kind.FUNCTION, "genie_atan_long_mp", "(void) atan_mp", true, null),
    SINH_LONG_MP(Kind.FUNCTION, "genie_sinh_long_mp", "(void) sinh_mp", true, null),
    COSH_LONG_MP(Kind.FUNCTION, "genie_cosh_long_mp", "(void) cosh_mp", true, null),
    TANH_LONG_MP(Kind.FUNCTION, "genie_tanh_long_mp", "(void) tanh_mp", true, null),
    ARCSINH_LONG_MP(Kind.FUNCTION, "genie_arcsinh_long_mp", "(void) asinh_mp", true, null),
    ARCCOSH_LONG_MP(Kind.FUNCTION, "genie_arccosh_long_mp", "(void) acosh_mp", true, null),
    ARCTANH_LONG_MP(Kind.FUNCTION, "genie_arctanh_long_mp", "(void) atanh_mp", true, null),

    // ============ 标准环境常量 ============

    INT_LENGTHS(Kind.CONSTANT, "genie_int_lengths", "3", intConstant(3)),
    INT_SHORTHS(Kind.CONSTANT, "genie_int_shorths", "1", intConstant(1)),
    REAL_LENGTHS(Kind.CONSTANT, "genie_real_lengths", "3", intConstant(3)),
    REAL_SHORTHS(Kind.CONSTANT, "genie_real_shorths", "1", intConstant(1)),
    COMPLEX_LENGTHS(Kind.CONSTANT, "genie_complex_lengths", "3", intConstant(3)),
    COMPLEX_SHORTHS(Kind.CONSTANT, "genie_complex_shorths", "1", intConstant(1)),
    BITS_LENGTHS(Kind.CONSTANT, "genie_bits_lengths", "3", intConstant(3)),
    BITS_SHORTHS(Kind.CONSTANT, "genie_bits_shorths", "1", intConstant(1)),
    BYTES_LENGTHS(Kind.CONSTANT, "genie_bytes_lengths", "2", intConstant(2)),
    BYTES_SHORTHS(Kind.CONSTANT, "genie_bytes_shorths", "1", intConstant(1)),
    INT_WIDTH(Kind.CONSTANT, "genie_int_width", "INT_WIDTH", intConstant(19)),
    LONG_INT_WIDTH(Kind.CONSTANT, "genie_long_int_width", "LONG_INT_WIDTH", intConstant(36)),
    REAL_WIDTH(Kind.CONSTANT, "genie_real_width", "REAL_WIDTH", intConstant(15)),
    LONG_REAL_WIDTH(Kind.CONSTANT, "genie_long_real_width", "LONG_REAL_WIDTH", intConstant(35)),
    EXP_WIDTH(Kind.CONSTANT, "genie_exp_width", "EXP_WIDTH", intConstant(3)),
    LONG_EXP_WIDTH(Kind.CONSTANT, "genie_long_exp_width", "LONG_EXP_WIDTH", intConstant(3)),
    BITS_WIDTH(Kind.CONSTANT, "genie_bits_width", "BITS_WIDTH", intConstant(64)),
    BYTES_WIDTH(Kind.CONSTANT, "genie_bytes_width", "BYTES_WIDTH", intConstant(32)),
    LONG_BYTES_WIDTH(Kind.CONSTANT, "genie_long_bytes_width", "LONG_BYTES_WIDTH", intConstant(256)),
    MAX_ABS_CHAR(Kind.CONSTANT, "genie_max_abs_char", "UCHAR_MAX", intConstant(255)),
    MAX_INT(Kind.CONSTANT, "genie_max_int", "A68_MAX_INT", intConstant(Long.MAX_VALUE)),
    MAX_REAL(Kind.CONSTANT, "genie_max_real", "DBL_MAX", s -> s.push(Value.ofReal(Double.MAX_VALUE))),
    MIN_REAL(Kind.CONSTANT, "genie_min_real", "DBL_MIN", s -> s.push(Value.ofReal(Double.MIN_NORMAL))),
    NULL_CHAR(Kind.CONSTANT, "genie_null_char", "NULL_CHAR", s -> s.push(Value.ofChar(0))),
    SMALL_REAL(Kind.CONSTANT, "genie_small_real", "DBL_EPSILON", s -> s.push(Value.ofReal(Math.ulp(1.0)))),
    PI(Kind.CONSTANT, "genie_pi", "A68_PI", s -> s.push(Value.ofReal(Math.PI))),
    PI_LONG_MP(Kind.CONSTANT, "genie_pi_long_mp", null, true,
            s -> s.push(Value.ofLong(Mode.LONG_REAL, new BigDecimal(Precision.PI_DIGITS, Precision.MP_CONTEXT)))),
    LONG_MAX_INT(Kind.CONSTANT, "genie_long_max_int", null, true,
            s -> s.push(Value.ofLong(Mode.LONG_INT, BigDecimal.TEN.pow(35).subtract(BigDecimal.ONE))));

    /** 原语表种类 */
    public enum Kind { MONADIC, DYADIC, FUNCTION, CONSTANT }

    /** 在折叠栈上重放原语 */
    @FunctionalInterface
    public interface Evaluation {
        void apply(ScratchStack stack);
    }

    /** LONG 模式的折叠精度：6 位 10^7 进制数字 */
    private static final class Precision {
        static final MathContext MP_CONTEXT = new MathContext(42, RoundingMode.HALF_EVEN);
        static final String PI_DIGITS = "3.14159265358979323846264338327950288419716939937510";
    }

    private static final Map<Kind, Map<String, Primitive>> TABLES = new EnumMap<>(Kind.class);

    static {
        for (Kind k : Kind.values()) {
            TABLES.put(k, new HashMap<>());
        }
        for (Primitive p : values()) {
            TABLES.get(p.kind).putIfAbsent(p.procedure, p);
        }
    }

    private final Kind kind;
    private final String procedure;
    private final String code;
    private final String checkCode;
    private final boolean multiPrecision;
    private final Evaluation evaluation;

    Primitive(Kind kind, String procedure, String code, Evaluation evaluation) {
        this(kind, procedure, code, code, false, evaluation);
    }

    Primitive(Kind kind, String procedure, String code, String checkCode, Evaluation evaluation) {
        this(kind, procedure, code, checkCode, false, evaluation);
    }

    Primitive(Kind kind, String procedure, String code, boolean multiPrecision, Evaluation evaluation) {
        this(kind, procedure, code, code, multiPrecision, evaluation);
    }

    Primitive(Kind kind, String procedure, String code, String checkCode, boolean multiPrecision, Evaluation evaluation) {
        this.kind = kind;
        this.procedure = procedure;
        this.code = code;
        this.checkCode = checkCode;
        this.multiPrecision = multiPrecision;
        this.evaluation = evaluation;
    }

    /**
     * 按原语身份查找。
     *
     * @return 未收录时返回 null
     */
    public static Primitive lookup(Kind kind, String procedure) {
        if (procedure == null) {
            return null;
        }
        return TABLES.get(kind).get(procedure);
    }

    public Kind getKind() { return kind; }
    public String getProcedure() { return procedure; }

    /** 生成代码中的文本；LONG 常量没有文本，只能折叠 */
    public String code(boolean check) {
        return check ? checkCode : code;
    }

    /** C 文本以字母开头时按函数调用形式输出 */
    public boolean isFunctionLike(boolean check) {
        String c = code(check);
        return c != null && !c.isEmpty() && Character.isLetterOrDigit(c.charAt(0));
    }

    /** 多精度原语，仅在启用 LONG 模式时可用 */
    public boolean isLong() {
        return multiPrecision;
    }

    public boolean isFoldable() {
        return evaluation != null;
    }

    /** 在折叠栈上执行；算术错误以 {@link ArithmeticException} 抛出 */
    public void evaluate(ScratchStack stack) {
        if (evaluation == null) {
            throw new IllegalStateException(name() + " 不能折叠");
        }
        evaluation.apply(stack);
    }

    // ---- 求值辅助 ----

    private static Evaluation intOp(LongBinaryOperator op) {
        return s -> {
            long b = s.popInt();
            long a = s.popInt();
            s.push(Value.ofInt(op.applyAsLong(a, b)));
        };
    }

    /** 整除；Long.MIN_VALUE / -1 溢出 */
    private static long overInt(long a, long b) {
        if (a == Long.MIN_VALUE && b == -1) {
            throw new ArithmeticException("long overflow");
        }
        return a / b;
    }

    private static Evaluation intConstant(long v) {
        return s -> s.push(Value.ofInt(v));
    }

    private static Evaluation realOp(DoubleBinaryOperator op) {
        return s -> {
            double b = s.popReal();
            double a = s.popReal();
            s.push(Value.ofReal(op.applyAsDouble(a, b)));
        };
    }

    private static Evaluation realFunction(DoubleUnaryOperator f) {
        return s -> {
            double y = f.applyAsDouble(s.popReal());
            if (Double.isNaN(y)) {
                throw new ArithmeticException("argument out of range");
            }
            s.push(Value.ofReal(y));
        };
    }

    private interface ComplexBinary {
        double[] apply(double[] a, double[] b);
    }

    private interface ComplexUnary {
        double[] apply(double[] z);
    }

    private static Evaluation complexOp(ComplexBinary op) {
        return s -> {
            Value b = s.popComplex();
            Value a = s.popComplex();
            double[] z = op.apply(new double[]{a.re(), a.im()}, new double[]{b.re(), b.im()});
            s.push(Value.ofComplex(z[0], z[1]));
        };
    }

    private static Evaluation complexFunction(ComplexUnary f) {
        return s -> {
            Value a = s.popComplex();
            double[] z = f.apply(new double[]{a.re(), a.im()});
            s.push(Value.ofComplex(z[0], z[1]));
        };
    }

    private interface MpBinary {
        BigDecimal apply(BigDecimal a, BigDecimal b, MathContext mc);
    }

    private interface IntPredicate {
        boolean test(int comparison);
    }

    private static Evaluation mpOp(Mode result, MpBinary op) {
        return s -> {
            BigDecimal b = s.popLong();
            BigDecimal a = s.popLong();
            s.push(Value.ofLong(result, op.apply(a, b, Precision.MP_CONTEXT)));
        };
    }

    private static Evaluation mpCompare(IntPredicate test) {
        return s -> {
            BigDecimal b = s.popLong();
            BigDecimal a = s.popLong();
            s.push(Value.ofBool(test.test(a.compareTo(b))));
        };
    }

    private static long mod(long a, long b) {
        long r = a % b;
        return r < 0 ? r + Math.abs(b) : r;
    }

    private static long toInt(double x) {
        if (Double.isNaN(x) || x < -9.223372036854775808E18 || x >= 9.223372036854775808E18) {
            throw new ArithmeticException("INT overflow");
        }
        return (long) x;
    }

    private static int toChar(long k) {
        if (k < 0 || k > 255) {
            throw new ArithmeticException("REPR argument out of range");
        }
        return (int) k;
    }

    private static double round(double x) {
        return x >= 0 ? Math.floor(x + 0.5) : -Math.floor(-x + 0.5);
    }

    private static long shift(long bits, long n) {
        if (n >= 64 || n <= -64) {
            return 0;
        }
        return n >= 0 ? bits << n : bits >>> -n;
    }

    private static double[] complexAdd(double[] a, double[] b) {
        return new double[]{a[0] + b[0], a[1] + b[1]};
    }

    private static double[] complexSub(double[] a, double[] b) {
        return new double[]{a[0] - b[0], a[1] - b[1]};
    }

    private static double[] complexMul(double[] a, double[] b) {
        return new double[]{a[0] * b[0] - a[1] * b[1], a[0] * b[1] + a[1] * b[0]};
    }

    private static double[] complexDiv(double[] a, double[] b) {
        double d = b[0] * b[0] + b[1] * b[1];
        if (d == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return new double[]{(a[0] * b[0] + a[1] * b[1]) / d, (a[1] * b[0] - a[0] * b[1]) / d};
    }

    private static double[] complexSqrt(double[] z) {
        double r = Math.hypot(z[0], z[1]);
        double re = Math.sqrt((r + z[0]) / 2.0);
        double im = Math.copySign(Math.sqrt((r - z[0]) / 2.0), z[1]);
        return new double[]{re, im};
    }

    private static double[] complexExp(double[] z) {
        double m = Math.exp(z[0]);
        return new double[]{m * Math.cos(z[1]), m * Math.sin(z[1])};
    }

    private static double[] complexLn(double[] z) {
        if (z[0] == 0.0 && z[1] == 0.0) {
            throw new ArithmeticException("LN of zero");
        }
        return new double[]{Math.log(Math.hypot(z[0], z[1])), Math.atan2(z[1], z[0])};
    }

    private static double[] complexSin(double[] z) {
        return new double[]{Math.sin(z[0]) * Math.cosh(z[1]), Math.cos(z[0]) * Math.sinh(z[1])};
    }

    private static double[] complexCos(double[] z) {
        return new double[]{Math.cos(z[0]) * Math.cosh(z[1]), -Math.sin(z[0]) * Math.sinh(z[1])};
    }
}
