package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 值被丢弃的公式：求值但不压栈。
 */
public final class VoidingFormulaRule extends AbstractRule {

    public VoidingFormulaRule() {
        super("voiding-formula", 2);
    }

    @Override
    public boolean matches(Node p) {
        Node sub = p.getSub();
        return p.is(Attribute.VOIDING) && sub != null
                && (sub.is(Attribute.FORMULA) || sub.is(Attribute.MONADIC_FORMULA));
    }

    @Override
    public Node subject(Node p) {
        return p.getSub();
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return ctx.getClassifier().isBasic(p);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("void_", p.getMode(), "_formula"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        String pop = pop(ctx, p);
        ctx.getEmitter().unit(p, Phase.DECLARE);
        declarations(ctx);
        ctx.out().indentf("%s = A68_SP;\n", pop);
        ctx.getEmitter().unit(p, Phase.EXECUTE);
        ctx.out().indent("(void) (");
        ctx.getEmitter().unit(p, Phase.YIELD);
        ctx.out().undent(");\n");
        ctx.out().indentf("A68_SP = %s;\n", pop);
    }
}
