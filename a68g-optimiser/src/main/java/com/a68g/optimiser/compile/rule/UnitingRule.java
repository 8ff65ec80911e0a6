package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

/**
 * 把基本值合一为联合：压入联合的模式标记与值，栈指针推进联合的大小。
 */
public final class UnitingRule extends AbstractRule {

    public UnitingRule() {
        super("uniting", 2);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.UNITING);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        Node q = p.getSub();
        Mode v = q == null ? null : q.getMode();
        return v != null && ctx.getClassifier().isBasic(q) && !v.isUnion() && ctx.getClassifier().primitiveMode(v);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getMode(), "_unite"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        CodeWriter out = ctx.out();
        Node q = p.getSub();
        String pop = Names.make(Names.PUP, "0", p.getNumber());
        ctx.declarations().declare("ADDR_T", 0, pop);
        ctx.getEmitter().unit(q, Phase.DECLARE);
        declarations(ctx);
        out.indentf("%s = A68_SP;\n", pop);
        out.indentf("PUSH_UNION (_NODE_ (%d), %s);\n", p.getNumber(), Names.internalMode(q.getMode()));
        ctx.getEmitter().unit(q, Phase.EXECUTE);
        ctx.getEmitter().push(q);
        out.indentf("A68_SP = %s + %d;\n", pop, p.getMode().getSize());
    }
}
