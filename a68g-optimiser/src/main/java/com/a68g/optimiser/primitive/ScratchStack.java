package com.a68g.optimiser.primitive;

import com.a68g.optimiser.CodegenException;
import com.a68g.syntax.Mode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 常量折叠用的私有求值栈，容量有限。
 * <p>
 * 弹出的值模式不符属于内部错误。COMPLEX 既可以是一个值，也可以是依次压入的两个 REAL
 * （并列子句按单元顺序压栈），见 {@link #popComplex()}。
 */
public final class ScratchStack {
    public static final int DEFAULT_CAPACITY = 256;

    private final Deque<Value> values = new ArrayDeque<>();
    private final int capacity;

    public ScratchStack() {
        this(DEFAULT_CAPACITY);
    }

    public ScratchStack(int capacity) {
        this.capacity = capacity;
    }

    public void push(Value v) {
        if (values.size() >= capacity) {
            throw new CodegenException("折叠栈溢出");
        }
        values.push(v);
    }

    public Value pop() {
        Value v = values.poll();
        if (v == null) {
            throw new CodegenException("折叠栈为空");
        }
        return v;
    }

    public Value peek() {
        return values.peek();
    }

    private Value pop(Mode mode) {
        Value v = pop();
        if (v.getMode() != mode) {
            throw new CodegenException("折叠栈模式不符: 期望 " + mode + ", 实际 " + v.getMode());
        }
        return v;
    }

    public long popInt() { return pop(Mode.INT).asInt(); }
    public double popReal() { return pop(Mode.REAL).asReal(); }
    public boolean popBool() { return pop(Mode.BOOL).asBool(); }
    public int popChar() { return pop(Mode.CHAR).asChar(); }
    public long popBits() { return pop(Mode.BITS).asBits(); }

    public BigDecimal popLong() {
        Value v = pop();
        if (!v.getMode().isLong()) {
            throw new CodegenException("折叠栈模式不符: 期望 LONG, 实际 " + v.getMode());
        }
        return v.asLong();
    }

    public Value popComplex() {
        Value top = pop();
        if (top.getMode() == Mode.COMPLEX) {
            return top;
        }
        if (top.getMode() != Mode.REAL) {
            throw new CodegenException("折叠栈模式不符: 期望 COMPLEX, 实际 " + top.getMode());
        }
        double re = popReal();
        return Value.ofComplex(re, top.asReal());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values.clear();
    }
}
