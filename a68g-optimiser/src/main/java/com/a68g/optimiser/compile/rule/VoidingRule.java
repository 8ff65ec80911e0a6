package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.CompileRule;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 其余的 VOIDING：编译被丢弃值的单元本身。
 */
public final class VoidingRule implements CompileRule {

    @Override
    public String getName() {
        return "voiding";
    }

    @Override
    public int getTier() {
        return 1;
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.VOIDING);
    }

    @Override
    public Node subject(Node p) {
        return p.getSub();
    }

    @Override
    public String compile(Node p, CompileMode mode, UnitCompiler units) {
        return units.compile(p, mode);
    }
}
