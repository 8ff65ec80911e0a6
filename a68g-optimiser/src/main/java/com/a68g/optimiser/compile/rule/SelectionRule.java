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
 * 结构字段，以及对字段名字的解引用。
 */
public final class SelectionRule extends AbstractRule {

    public SelectionRule() {
        super("selection", 2);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.SELECTION)
                || (p.is(Attribute.DEREFERENCING) && stemsFrom(p.getSub(), Attribute.SELECTION) != null);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return ctx.getClassifier().basicMode(p.getMode()) && ctx.getClassifier().isBasic(p);
    }

    @Override
    protected String functionName(Node p) {
        String prefix = p.is(Attribute.DEREFERENCING) ? "deref_REF_" : "";
        return Names.make(Names.withMode(prefix, p.getMode(), "_select"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        pushUnit(p, units.getContext());
    }
}
