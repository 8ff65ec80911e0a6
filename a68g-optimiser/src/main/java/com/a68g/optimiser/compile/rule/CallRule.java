package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 过程调用。
 * <p>
 * 标准环境函数内联为原语调用；用户过程按解释器的约定打开过程帧、放入实参、执行过程体。
 */
public final class CallRule extends AbstractRule {

    public CallRule() {
        super("call", 1);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.CALL);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        if (!callable(p, ctx.getClassifier())) {
            return false;
        }
        Node idf = stemsFrom(p.getSub(), Attribute.IDENTIFIER);
        if (idf.getTag().isStandenv()) {
            return ctx.getClassifier().basicCall(p);
        }
        return userProcedure(p, ctx.getClassifier());
    }

    /** 被调用者是有标签的标识符，返回 VOID 或基本模式，且有参数 */
    static boolean callable(Node call, EligibilityClassifier classifier) {
        Node proc = call.getSub();
        Node idf = stemsFrom(proc, Attribute.IDENTIFIER);
        if (idf == null || idf.getTag() == null) {
            return false;
        }
        Mode m = proc.getMode();
        if (m == null || !m.isProc()) {
            return false;
        }
        Mode yield = proc.subMode();
        if (yield != Mode.VOID && !classifier.basicMode(yield)) {
            return false;
        }
        return m.getDim() != 0;
    }

    /** 由过程声明定义、非部分参数化、实参都是基本单元的用户过程 */
    static boolean userProcedure(Node call, EligibilityClassifier classifier) {
        Node proc = call.getSub();
        Node idf = stemsFrom(proc, Attribute.IDENTIFIER);
        if (!idf.getTag().isProcDeclaration()) {
            return false;
        }
        if (proc.getPartialProc() != null && proc.getPartialProc().getDim() != 0) {
            return false;
        }
        return classifier.basicArgument(proc.getNext());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getSub().subMode(), "_call"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        Node idf = stemsFrom(p.getSub(), Attribute.IDENTIFIER);
        if (idf.getTag().isStandenv()) {
            pushUnit(p, ctx);
        } else {
            userCall(p, ctx, false);
        }
    }

    /**
     * 用户过程调用：实参先在调用者的帧中求值，打开过程帧后依次写入帧对象。
     *
     * @param voiding 调用之后丢弃结果，恢复栈指针
     */
    static void userCall(Node call, CompilerContext ctx, boolean voiding) {
        StagedEmitter emitter = ctx.getEmitter();
        Node proc = call.getSub();
        Node args = proc.getNext();
        Node idf = stemsFrom(proc, Attribute.IDENTIFIER);
        String fun = Names.make(Names.FUN, proc.getNumber());
        String pop = Names.make(Names.PUP, call.getNumber());
        emitter.arguments(args, Phase.DECLARE, new int[1]);
        ctx.declarations().declare("ADDR_T", 0, pop);
        ctx.declarations().declare("A68_PROCEDURE", 1, fun);
        ctx.declarations().declare("NODE_T", 1, "body");
        declarations(ctx);
        ctx.out().indentf("%s = A68_SP;\n", pop);
        emitter.arguments(args, Phase.INITIALISE, new int[1]);
        callProcedure(ctx, idf, fun, "NEXT_NEXT_NEXT (body)", () -> {
            emitter.arguments(args, Phase.EXECUTE, new int[1]);
            emitter.arguments(args, Phase.YIELD, new int[1]);
            ctx.out().indentf("A68_SP = %s;\n", pop);
        }, null);
        if (voiding) {
            ctx.out().indentf("A68_SP = %s;\n", pop);
        }
    }
}
