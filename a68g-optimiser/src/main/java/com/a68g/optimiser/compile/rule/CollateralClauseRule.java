package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 结构显示，例如 COMPLEX 的 {@code (re, im)}：各字段依次压栈。
 */
public final class CollateralClauseRule extends AbstractRule {

    public CollateralClauseRule() {
        super("collateral-clause", 3);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.COLLATERAL_CLAUSE);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return p.getMode() != null && p.getMode().isStruct() && ctx.getClassifier().isBasic(p);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make("collateral", p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        StagedEmitter emitter = ctx.getEmitter();
        emitter.collateralUnits(p.nextSub(), Phase.DECLARE);
        declarations(ctx);
        emitter.collateralUnits(p.nextSub(), Phase.EXECUTE);
        emitter.collateralUnits(p.nextSub(), Phase.YIELD);
    }
}
