package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.analysis.Trees;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.CompileRule;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * 条件子句。
 * <p>
 * 每个分支恰好一个基本单元时，条件与分支都内联；
 * 否则只要求各条件是基本单元，分支的串行子句在静态帧中执行。
 */
public final class ConditionalClauseRule implements CompileRule {

    private final BasicConditional basic = new BasicConditional();
    private final GeneralConditional general = new GeneralConditional();

    @Override
    public String getName() {
        return "conditional-clause";
    }

    @Override
    public int getTier() {
        return 3;
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CONDITIONAL_CLAUSE);
    }

    @Override
    public String compile(Node p, CompileMode mode, UnitCompiler units) {
        String fn = basic.compile(p, mode, units);
        return fn != null ? fn : general.compile(p, mode, units);
    }

    /** IF、ELIF 的条件部分与它后面的分支 */
    static final class Arm {
        final Node condition;
        final List<Node> branches = new ArrayList<>();

        Arm(Node condition) {
            this.condition = condition;
        }
    }

    /**
     * 按源码顺序列出各条件部分及其分支：ELIF 部分展开到它的子节点，FI 与 ) 跳过。
     */
    static List<Arm> arms(Node p) {
        List<Arm> arms = new ArrayList<>();
        Node q = p.getSub();
        while (q != null && isCondition(q)) {
            Arm arm = new Arm(q);
            arms.add(arm);
            q = q.getNext();
            while (q != null && (q.is(Attribute.THEN_PART) || q.is(Attribute.ELSE_PART) || q.is(Attribute.CHOICE))) {
                arm.branches.add(q);
                q = q.getNext();
            }
            if (q != null && (q.is(Attribute.ELIF_PART) || q.is(Attribute.BRIEF_ELIF_PART))) {
                q = q.getSub();
            } else if (q != null && (q.is(Attribute.FI_SYMBOL) || q.is(Attribute.CLOSE_SYMBOL))) {
                q = q.getNext();
            }
        }
        return arms;
    }

    private static boolean isCondition(Node q) {
        return q.is(Attribute.IF_PART) || q.is(Attribute.OPEN_PART)
                || q.is(Attribute.ELIF_IF_PART) || q.is(Attribute.ELSE_OPEN_PART);
    }

    // ================================================================
    // 内联分支
    // ================================================================

    static final class BasicConditional extends AbstractRule {

        BasicConditional() {
            super("basic-conditional", 3);
        }

        @Override
        public boolean matches(Node p) {
            return p.is(Attribute.CONDITIONAL_CLAUSE);
        }

        @Override
        protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
            Mode m = p.getMode();
            if (!(m == Mode.VOID || ctx.getClassifier().basicMode(m))) {
                return false;
            }
            return ctx.getClassifier().basicConditional(p.getSub());
        }

        @Override
        protected Node anchor(Node p) {
            return p.getSub();
        }

        @Override
        protected String functionName(Node p) {
            return Names.make("conditional", p.getSub().getNumber());
        }

        @Override
        protected void body(Node p, CompileMode mode, UnitCompiler units) {
            CompilerContext ctx = units.getContext();
            Node ifPart = p.getSub();
            Node thenPart = ifPart.getNext();
            Node elsePart = thenPart.getNext();
            if (elsePart != null && !(elsePart.is(Attribute.ELSE_PART) || elsePart.is(Attribute.CHOICE))) {
                elsePart = null;
            }
            Node t = Trees.firstUnit(thenPart.nextSub());
            Node e = elsePart != null ? Trees.firstUnit(elsePart.nextSub()) : null;
            if (p.getMode() != Mode.VOID && ctx.getFolder().isConstant(t, ctx)
                    && (e == null || ctx.getFolder().isConstant(e, ctx))) {
                // 分支都是常量：整个子句压入一个条件表达式
                pushUnit(p, ctx);
                return;
            }
            StagedEmitter emitter = ctx.getEmitter();
            CodeWriter out = ctx.out();
            Node c = Trees.firstUnit(ifPart.nextSub());
            emitter.unit(c, Phase.DECLARE);
            declarations(ctx);
            emitter.unit(c, Phase.EXECUTE);
            out.indent("if (");
            emitter.unit(c, Phase.YIELD);
            out.undent(") {\n");
            branch(t, units);
            if (e != null) {
                out.indent("} else {\n");
                branch(e, units);
            }
            out.indent("}\n");
        }

        /** 分支单元内联；不能内联时交给解释器执行 */
        private static void branch(Node u, UnitCompiler units) {
            CompilerContext ctx = units.getContext();
            CodeWriter out = ctx.out();
            int mark = ctx.booking().mark();
            out.in();
            if (units.compile(u, CompileMode.INLINE) == null) {
                out.indentf("EXECUTE_UNIT_TRACE (_NODE_ (%d));\n", u.getNumber());
            }
            out.out();
            ctx.booking().truncate(mark);
        }
    }

    // ================================================================
    // 嵌入的串行子句
    // ================================================================

    static final class GeneralConditional extends AbstractRule {

        GeneralConditional() {
            super("conditional", 3);
        }

        @Override
        public boolean matches(Node p) {
            return p.is(Attribute.CONDITIONAL_CLAUSE);
        }

        @Override
        protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
            if (p.getMode() != Mode.VOID) {
                return false;
            }
            List<Arm> arms = arms(p);
            if (arms.isEmpty()) {
                return false;
            }
            for (Arm arm : arms) {
                if (!ctx.getClassifier().basicSerial(arm.condition.nextSub(), 1)) {
                    return false;
                }
                for (Node b : arm.branches) {
                    if (ClosedClauseRule.hasLabels(b.nextSub())) {
                        return false;
                    }
                }
            }
            return true;
        }

        @Override
        protected void prepare(Node p, UnitCompiler units) {
            for (Arm arm : arms(p)) {
                for (Node b : arm.branches) {
                    units.serialClauses().prepare(b.nextSub());
                }
            }
        }

        @Override
        protected String functionName(Node p) {
            return Names.make("conditional", p.getNumber());
        }

        @Override
        protected void body(Node p, CompileMode mode, UnitCompiler units) {
            CompilerContext ctx = units.getContext();
            StagedEmitter emitter = ctx.getEmitter();
            CodeWriter out = ctx.out();
            List<Arm> arms = arms(p);
            for (Arm arm : arms) {
                emitter.unit(Trees.firstUnit(arm.condition.nextSub()), Phase.DECLARE);
            }
            String pop = pop(ctx, p);
            declarations(ctx);
            out.indentf("%s = A68_SP;\n", pop);
            for (Arm arm : arms) {
                emitter.unit(Trees.firstUnit(arm.condition.nextSub()), Phase.EXECUTE);
            }
            boolean first = true;
            for (Arm arm : arms) {
                out.indent(first ? "if (" : "} else if (");
                first = false;
                emitter.unit(Trees.firstUnit(arm.condition.nextSub()), Phase.YIELD);
                out.undent(") {\n");
                boolean elsePart = false;
                for (Node b : arm.branches) {
                    if (elsePart) {
                        out.indent("} else {\n");
                    }
                    out.in();
                    units.serialClauses().embed(b.nextSub(), pop);
                    out.out();
                    elsePart = true;
                }
            }
            out.indent("}\n");
        }
    }
}
