package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

/**
 * VOID 的封闭子句：串行子句在静态帧中逐个执行。
 */
public final class ClosedClauseRule extends AbstractRule {

    public ClosedClauseRule() {
        super("closed-clause", 3);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CLOSED_CLAUSE);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        Node sc = p.nextSub();
        return p.getMode() == Mode.VOID && sc != null && !hasLabels(sc);
    }

    static boolean hasLabels(Node sc) {
        return sc != null && sc.getTable() != null && sc.getTable().hasLabels();
    }

    @Override
    protected void prepare(Node p, UnitCompiler units) {
        units.serialClauses().prepare(p.nextSub());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make("closed", p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        String pop = pop(ctx, p);
        declarations(ctx);
        ctx.out().indentf("%s = A68_SP;\n", pop);
        units.serialClauses().embed(p.nextSub(), pop);
    }
}
