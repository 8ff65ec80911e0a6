package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 结果被丢弃的用户过程调用。
 */
public final class VoidingCallRule extends AbstractRule {

    public VoidingCallRule() {
        super("voiding-call", 2);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.VOIDING) && p.getSub() != null && p.getSub().is(Attribute.CALL);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        Node call = p.getSub();
        if (!CallRule.callable(call, ctx.getClassifier())) {
            return false;
        }
        if (stemsFrom(call.getSub(), Attribute.IDENTIFIER).getTag().isStandenv()) {
            return false;
        }
        return CallRule.userProcedure(call, ctx.getClassifier());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("void_", p.getSub().getSub().subMode(), "_call"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CallRule.userCall(p.getSub(), units.getContext(), true);
    }
}
