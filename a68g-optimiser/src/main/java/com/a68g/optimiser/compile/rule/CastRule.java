package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 强制转换：压入被转换单元的值。
 */
public final class CastRule extends AbstractRule {

    public CastRule() {
        super("cast", 1);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CAST);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        if (!ctx.getClassifier().isBasic(p)) {
            return false;
        }
        return mode == CompileMode.INLINE || ctx.getClassifier().folderMode(p.getMode());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getMode(), "_cast"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        pushUnit(p, units.getContext());
    }
}
