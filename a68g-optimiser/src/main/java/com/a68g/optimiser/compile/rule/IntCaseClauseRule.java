package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.analysis.Trees;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.SourceComments;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import java.util.List;

/**
 * VOID 的整数分情形子句，选择子为一个基本单元，生成 C 的 switch。
 */
public final class IntCaseClauseRule extends AbstractRule {

    public IntCaseClauseRule() {
        super("int-case-clause", 3);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CASE_CLAUSE);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        if (p.getMode() != Mode.VOID) {
            return false;
        }
        Node q = p.getSub();
        if (q == null || !(q.is(Attribute.CASE_PART) || q.is(Attribute.OPEN_PART))) {
            return false;
        }
        if (!ctx.getClassifier().basicSerial(q.nextSub(), 1)) {
            return false;
        }
        q = q.getNext();
        while (q != null && (q.is(Attribute.CASE_IN_PART) || q.is(Attribute.OUT_PART) || q.is(Attribute.CHOICE))) {
            if (ClosedClauseRule.hasLabels(q.nextSub())) {
                return false;
            }
            q = q.getNext();
        }
        return q != null && (q.is(Attribute.ESAC_SYMBOL) || q.is(Attribute.CLOSE_SYMBOL));
    }

    private static Node inPart(Node p) {
        return p.getSub().getNext();
    }

    /** IN 部分之后的 OUT 部分，没有时为 null */
    private static Node outPart(Node p) {
        Node q = inPart(p).getNext();
        return q != null && (q.is(Attribute.OUT_PART) || q.is(Attribute.CHOICE)) ? q : null;
    }

    @Override
    protected void prepare(Node p, UnitCompiler units) {
        for (Node u : Trees.units(inPart(p).nextSub())) {
            units.serialClauses().compileOther(u);
        }
        Node out = outPart(p);
        if (out != null) {
            units.serialClauses().prepare(out.nextSub());
        }
    }

    @Override
    protected String functionName(Node p) {
        return Names.make("case", p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        StagedEmitter emitter = ctx.getEmitter();
        CodeWriter out = ctx.out();
        Node selector = Trees.firstUnit(p.getSub().nextSub());
        Node in = inPart(p);
        emitter.unit(selector, Phase.DECLARE);
        String pop = pop(ctx, p);
        declarations(ctx);
        out.indentf("%s = A68_SP;\n", pop);
        emitter.unit(selector, Phase.EXECUTE);
        out.indent("switch (");
        emitter.unit(selector, Phase.YIELD);
        out.undent(") {\n");
        out.in();
        List<Node> choices = Trees.units(in.nextSub());
        for (int k = 1; k <= choices.size(); k++) {
            Node u = choices.get(k - 1);
            out.indentf("case %d: {\n", k);
            out.in();
            out.indentf("OPEN_STATIC_FRAME (_NODE_ (%d));\n", in.getSub().getNumber());
            out.indentf("EXECUTE_UNIT_TRACE (_NODE_ (%d));", u.getNumber());
            SourceComments.inline(u, out);
            out.undent("\n");
            out.indent("CLOSE_FRAME;\n");
            out.indent("break;\n");
            out.out();
            out.indent("}\n");
        }
        Node outPart = outPart(p);
        if (outPart != null) {
            out.indent("default: {\n");
            out.in();
            units.serialClauses().embed(outPart.nextSub(), pop);
            out.indent("break;\n");
            out.out();
            out.indent("}\n");
        }
        out.out();
        out.indent("}\n");
    }
}
