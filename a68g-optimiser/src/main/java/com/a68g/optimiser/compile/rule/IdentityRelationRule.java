package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 名字的同一关系 {@code :=:} 与 {@code :/=:}，右边为名字或 NIL。
 */
public final class IdentityRelationRule extends AbstractRule {

    public IdentityRelationRule() {
        super("identity-relation", 2);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.IDENTITY_RELATION);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return ctx.getClassifier().isBasic(p);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getMode(), "_identity"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        pushUnit(p, units.getContext());
    }
}
