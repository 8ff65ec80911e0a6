package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 无参过程的调用（去过程化），以及结果被丢弃的去过程化。
 */
public final class DeproceduringRule extends AbstractRule {

    public DeproceduringRule() {
        super("deproceduring", 2);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.DEPROCEDURING) || voiding(p);
    }

    private static boolean voiding(Node p) {
        return p.is(Attribute.VOIDING) && p.getSub() != null && p.getSub().is(Attribute.DEPROCEDURING);
    }

    private static Node deproceduring(Node p) {
        return voiding(p) ? p.getSub() : p;
    }

    private static Node identifier(Node p) {
        return stemsFrom(deproceduring(p).getSub(), Attribute.IDENTIFIER);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        Node idf = identifier(p);
        if (idf == null || idf.getTag() == null || idf.getMode() == null) {
            return false;
        }
        Mode yield = idf.subMode();
        if (yield != Mode.VOID && !ctx.getClassifier().basicMode(yield)) {
            return false;
        }
        return idf.getTag().isProcDeclaration();
    }

    @Override
    protected String functionName(Node p) {
        Mode m = deproceduring(p).getMode();
        return Names.make(Names.withMode(voiding(p) ? "void_" : "", m, "_deproc"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        Node idf = identifier(p);
        String fun = Names.make(Names.FUN, idf.getNumber());
        String pop = voiding(p) ? pop(ctx, p) : null;
        ctx.declarations().declare("A68_PROCEDURE", 1, fun);
        ctx.declarations().declare("NODE_T", 1, "body");
        declarations(ctx);
        if (pop != null) {
            ctx.out().indentf("%s = A68_SP;\n", pop);
        }
        callProcedure(ctx, idf, fun, "NEXT_NEXT (body)", null, pop);
    }
}
