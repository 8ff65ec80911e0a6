package com.a68g.optimiser.fold;

import com.a68g.optimiser.CodegenException;
import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.OptimiserDiagnostic.Severity;
import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.analysis.Trees;
import com.a68g.optimiser.emit.BookAction;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.primitive.Primitive;
import com.a68g.optimiser.primitive.ScratchStack;
import com.a68g.optimiser.primitive.Value;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import java.util.HashSet;
import java.util.Set;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 常量折叠。
 * <p>
 * {@link #isConstant} 判定节点的值能否在编译期算出；{@link #fold} 在私有暂存栈上重放
 * 标准环境原语，把结果写成 C 字面量。对非常量节点调用 {@link #evaluate} 是内部错误。
 * <p>
 * 自引用的恒等声明（如 {@code INT a = a + 1}）靠一次判定内的访问集合打断循环，
 * 再次访问同一个标识符时报告“可能未初始化”。
 */
public final class ConstantFolder {

    private final EligibilityClassifier classifier;

    public ConstantFolder(EligibilityClassifier classifier) {
        this.classifier = classifier;
    }

    // ============ 判定 ============

    /** 不报告诊断的判定 */
    public boolean isConstant(Node p) {
        return constantUnit(p, new HashSet<>(), null);
    }

    public boolean isConstant(Node p, CompilerContext ctx) {
        return constantUnit(p, new HashSet<>(), ctx);
    }

    private boolean constantUnit(Node p, Set<Node> visited, CompilerContext ctx) {
        if (p == null) {
            return false;
        }
        switch (p.getAttribute()) {
            case UNIT:
            case TERTIARY:
            case SECONDARY:
            case PRIMARY:
            case ENCLOSED_CLAUSE:
                return constantUnit(p.getSub(), visited, ctx);
            case CLOSED_CLAUSE:
                return constantSerial(p.nextSub(), visited, ctx);
            case COLLATERAL_CLAUSE:
                return classifier.folderMode(p.getMode()) && constantUnits(p.nextSub(), visited, ctx);
            case WIDENING:
                if (EligibilityClassifier.widensTo(p, Mode.INT, Mode.REAL)
                        || EligibilityClassifier.widensTo(p, Mode.REAL, Mode.COMPLEX)) {
                    return constantUnit(p.getSub(), visited, ctx);
                }
                return false;
            case IDENTIFIER:
                return constantIdentifier(p, visited, ctx);
            case DENOTATION:
                return classifier.denotationMode(p.getMode());
            case MONADIC_FORMULA:
                return classifier.folderMode(p.getMode()) && constantMonadic(p, visited, ctx);
            case FORMULA:
                return classifier.folderMode(p.getMode()) && constantFormula(p, visited, ctx);
            case CALL:
                return classifier.folderMode(p.getMode()) && constantCall(p, visited, ctx);
            case CAST:
                return p.getSub() != null && classifier.folderMode(p.getSub().getMode())
                        && constantUnit(p.nextSub(), visited, ctx);
            default:
                return false;
        }
    }

    private boolean constantIdentifier(Node p, Set<Node> visited, CompilerContext ctx) {
        if (p.getTag() == null) {
            return false;
        }
        if (p.getTag().isStandenv()) {
            Primitive prim = classifier.primitive(Primitive.Kind.CONSTANT, p);
            return prim != null && prim.isFoldable();
        }
        if (!visited.add(p)) {
            if (ctx != null) {
                ctx.report(Severity.WARNING, "identifier " + p.getSymbol() + " might be used uninitialised", p);
            }
            return false;
        }
        try {
            Node def = p.getTag().getNode();
            return classifier.folderMode(p.getMode()) && def != null && def.getNext() != null
                    && def.getNext().is(Attribute.EQUALS_SYMBOL)
                    && constantUnit(def.nextNext(), visited, ctx);
        } finally {
            visited.remove(p);
        }
    }

    /** 恰好一个单元且为常量 */
    private boolean constantSerial(Node p, Set<Node> visited, CompilerContext ctx) {
        int[] count = new int[2];
        countConstantUnits(p, visited, ctx, count);
        return count[0] == 1 && count[1] == 1;
    }

    private void countConstantUnits(Node p, Set<Node> visited, CompilerContext ctx, int[] count) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                count[0]++;
                if (constantUnit(p, visited, ctx)) {
                    count[1]++;
                }
            } else if (p.is(Attribute.DECLARATION_LIST)) {
                count[0]++;
            } else {
                countConstantUnits(p.getSub(), visited, ctx, count);
            }
        }
    }

    /** 并列子句与实参：每个单元都是折叠模式的常量 */
    private boolean constantUnits(Node p, Set<Node> visited, CompilerContext ctx) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                if (!(classifier.folderMode(p.getMode()) && constantUnit(p, visited, ctx))) {
                    return false;
                }
            } else if (!constantUnits(p.getSub(), visited, ctx)) {
                return false;
            }
        }
        return true;
    }

    private boolean constantCall(Node p, Set<Node> visited, CompilerContext ctx) {
        Node prim = p.getSub();
        Node idf = stemsFrom(prim, Attribute.IDENTIFIER);
        if (idf == null) {
            return false;
        }
        Primitive f = classifier.primitive(Primitive.Kind.FUNCTION, idf);
        return f != null && f.isFoldable() && constantUnits(prim.getNext(), visited, ctx);
    }

    private boolean constantMonadic(Node p, Set<Node> visited, CompilerContext ctx) {
        if (!p.is(Attribute.MONADIC_FORMULA)) {
            return false;
        }
        Node op = p.getSub();
        Primitive m = classifier.primitive(Primitive.Kind.MONADIC, op);
        return m != null && m.isFoldable() && constantUnit(op.getNext(), visited, ctx);
    }

    private boolean constantFormula(Node p, Set<Node> visited, CompilerContext ctx) {
        Node lhs = p.getSub();
        Node op = lhs.getNext();
        if (op == null) {
            return constantMonadic(lhs, visited, ctx);
        }
        Primitive d = classifier.primitive(Primitive.Kind.DYADIC, op);
        return d != null && d.isFoldable()
                && constantUnit(lhs, visited, ctx) && constantUnit(op.getNext(), visited, ctx);
    }

    // ============ 求值 ============

    /**
     * 计算常量节点的值。算术错误记为折叠错误并返回零值。
     *
     * @throws CodegenException 节点不是常量，或求值后暂存栈不为空
     */
    public Value evaluate(Node p, CompilerContext ctx) {
        ScratchStack stack = new ScratchStack();
        Mode m = p.getMode();
        try {
            push(p, stack, ctx);
        } catch (ArithmeticException e) {
            ctx.report(Severity.ERROR, "constant folding: " + e.getMessage(), p);
            ctx.codeError();
            return Value.zero(m);
        }
        Value v = m == Mode.COMPLEX ? stack.popComplex() : stack.pop();
        if (!stack.isEmpty()) {
            throw new CodegenException("折叠后暂存栈不为空", p);
        }
        return v;
    }

    private void push(Node p, ScratchStack stack, CompilerContext ctx) {
        if (p == null) {
            throw new CodegenException("折叠到空节点");
        }
        switch (p.getAttribute()) {
            case UNIT:
            case TERTIARY:
            case SECONDARY:
            case PRIMARY:
            case ENCLOSED_CLAUSE:
                push(p.getSub(), stack, ctx);
                break;
            case CLOSED_CLAUSE: {
                Node unit = Trees.firstUnit(p.nextSub());
                push(unit, stack, ctx);
                break;
            }
            case COLLATERAL_CLAUSE:
                pushUnits(p.nextSub(), stack, ctx);
                break;
            case WIDENING:
                push(p.getSub(), stack, ctx);
                if (EligibilityClassifier.widensTo(p, Mode.INT, Mode.REAL)) {
                    stack.push(Value.ofReal((double) stack.popInt()));
                } else if (EligibilityClassifier.widensTo(p, Mode.REAL, Mode.COMPLEX)) {
                    stack.push(Value.ofReal(0.0));
                }
                break;
            case IDENTIFIER:
                if (p.getTag().isStandenv()) {
                    Primitive.lookup(Primitive.Kind.CONSTANT, p.getTag().getProcedure()).evaluate(stack);
                } else {
                    push(p.getTag().getNode().nextNext(), stack, ctx);
                }
                break;
            case DENOTATION:
                pushDenotation(p, stack, ctx);
                break;
            case MONADIC_FORMULA: {
                Node op = p.getSub();
                push(op.getNext(), stack, ctx);
                operator(Primitive.Kind.MONADIC, op).evaluate(stack);
                break;
            }
            case FORMULA: {
                Node lhs = p.getSub();
                Node op = lhs.getNext();
                push(lhs, stack, ctx);
                if (op != null) {
                    push(op.getNext(), stack, ctx);
                    operator(Primitive.Kind.DYADIC, op).evaluate(stack);
                }
                break;
            }
            case CALL: {
                Node prim = p.getSub();
                pushUnits(prim.getNext(), stack, ctx);
                operator(Primitive.Kind.FUNCTION, stemsFrom(prim, Attribute.IDENTIFIER)).evaluate(stack);
                break;
            }
            case CAST:
                push(p.nextSub(), stack, ctx);
                break;
            default:
                throw new CodegenException("不能折叠的节点", p);
        }
    }

    private static Primitive operator(Primitive.Kind kind, Node op) {
        Primitive prim = op != null && op.getTag() != null ? Primitive.lookup(kind, op.getTag().getProcedure()) : null;
        if (prim == null || !prim.isFoldable()) {
            throw new CodegenException("不能折叠的原语", op);
        }
        return prim;
    }

    private void pushUnits(Node p, ScratchStack stack, CompilerContext ctx) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                push(p, stack, ctx);
            } else {
                pushUnits(p.getSub(), stack, ctx);
            }
        }
    }

    private static void pushDenotation(Node p, ScratchStack stack, CompilerContext ctx) {
        try {
            stack.push(Denotations.value(p));
        } catch (NumberFormatException e) {
            ctx.report(Severity.ERROR, "error in " + p.getMode() + " denotation " + Denotations.text(p), p);
            ctx.codeError();
            stack.push(Value.zero(p.getMode()));
        }
    }

    // ============ 输出 ============

    /**
     * 按阶段输出常量。COMPLEX 与 LONG 在 DECLARE 阶段输出带初值的局部变量，
     * 其余模式只在 YIELD 阶段输出字面量。
     */
    public void fold(Node p, Phase phase, CompilerContext ctx) {
        Mode m = p.getMode();
        CodeWriter out = ctx.out();
        String acc = Names.make(Names.CON, p.getNumber());
        if (phase == Phase.DECLARE) {
            if ((m == Mode.COMPLEX || classifier.longMode(m))
                    && ctx.booking().lookup(BookAction.CONSTANT, Phase.DECLARE, p) == null) {
                Value v = evaluate(p, ctx);
                if (m == Mode.COMPLEX) {
                    out.indentf("A68_COMPLEX %s = {{INIT_MASK, %s}, {INIT_MASK, %s}};\n",
                            acc, CFormat.real(v.re()), CFormat.real(v.im()));
                } else {
                    out.indentf("A68_LONG %s = {%s};\n", acc, MultiPrecision.of(v.asLong()).initialiser());
                }
                ctx.booking().remember(BookAction.CONSTANT, Phase.DECLARE, p, null, p.getNumber());
            }
        } else if (phase == Phase.YIELD) {
            if (m == Mode.COMPLEX) {
                out.undentf("(A68_REAL *) %s", acc);
            } else if (classifier.longMode(m)) {
                out.undentf("(MP_DIGIT_T *) %s", acc);
            } else {
                out.undent(literal(p, evaluate(p, ctx), ctx));
            }
        }
    }

    /** 出错时代替的零值字面量 */
    public String zeroLiteral(Node p, CompilerContext ctx) {
        return literal(p, Value.zero(p.getMode()), ctx);
    }

    /** 基本模式值的 C 字面量 */
    String literal(Node p, Value v, CompilerContext ctx) {
        Mode m = p.getMode();
        if (m == Mode.INT) {
            return Long.toString(v.asInt());
        } else if (m == Mode.REAL) {
            return realLiteral(p, v.asReal(), ctx);
        } else if (m == Mode.BOOL) {
            return CFormat.bool(v.asBool());
        } else if (m == Mode.CHAR) {
            return CFormat.character(v.asChar());
        } else if (m == Mode.BITS) {
            return CFormat.bits(v.asBits());
        }
        throw new CodegenException("不能折叠的模式 " + m, p);
    }

    private static String realLiteral(Node p, double x, CompilerContext ctx) {
        if (!Double.isFinite(x)) {
            ctx.report(Severity.ERROR, "constant folding: REAL value out of range", p);
            ctx.codeError();
            x = 0.0;
        }
        if (x == Double.MAX_VALUE) {
            return "DBL_MAX";
        } else if (x == -Double.MAX_VALUE) {
            return "(-DBL_MAX)";
        }
        String s = CFormat.real(x);
        if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
            s = s + ".0";
        }
        return s;
    }
}
