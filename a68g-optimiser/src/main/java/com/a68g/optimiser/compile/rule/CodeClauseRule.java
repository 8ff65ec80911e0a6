package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * CODE 子句：其中的字符串原样作为 C 代码输出。
 */
public final class CodeClauseRule extends AbstractRule {

    public CodeClauseRule() {
        super("code-clause", 0);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CODE_CLAUSE);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return true;
    }

    @Override
    protected String functionName(Node p) {
        return Names.make("code", p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        text(p.getSub(), units.getContext().out());
    }

    private static void text(Node p, CodeWriter out) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.ROW_CHAR_DENOTATION)) {
                out.indent(p.getSymbol() + "\n");
            }
            text(p.getSub(), out);
        }
    }
}
