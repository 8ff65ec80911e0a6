package com.a68g.optimiser.compile;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.FrameCode;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.SourceComments;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.optimiser.emit.UniqueNames;
import com.a68g.syntax.Node;

/**
 * 编译规则的骨架：判定、预编译嵌套单元、源码注释、函数入口、函数体、函数出口。
 */
public abstract class AbstractRule implements CompileRule {

    private final String name;
    private final int tier;

    protected AbstractRule(String name, int tier) {
        this.name = name;
        this.tier = tier;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getTier() {
        return tier;
    }

    /**
     * 能否以给定方式编译该节点。只读取树与模式，不得输出。
     */
    protected abstract boolean accepts(Node p, CompileMode mode, CompilerContext ctx);

    /** 生成函数名 */
    protected abstract String functionName(Node p);

    /** 函数体 */
    protected abstract void body(Node p, CompileMode mode, UnitCompiler units);

    /**
     * 在函数入口之前把嵌套的单元编译为各自的函数；只在 FUNCTION 方式下调用。
     */
    protected void prepare(Node p, UnitCompiler units) {
    }

    /** 注释与函数入口所依附的节点 */
    protected Node anchor(Node p) {
        return p;
    }

    @Override
    public String compile(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        if (!accepts(p, mode, ctx)) {
            return null;
        }
        String fn = functionName(p);
        if (mode == CompileMode.DRY) {
            return fn;
        }
        Node a = anchor(p);
        if (mode == CompileMode.FUNCTION) {
            prepare(p, units);
            SourceComments.comment(a, ctx.out());
            FrameCode.functionPrelude(ctx, a, fn);
        } else {
            SourceComments.comment(a, ctx.out());
        }
        ctx.declarations().clear();
        body(p, mode, units);
        if (mode == CompileMode.FUNCTION) {
            FrameCode.functionPostlude(ctx);
        }
        return fn;
    }

    /**
     * 按值或帧地址共享的函数：同名函数已生成时直接引用，登记表已满时改用备用名。
     *
     * @param unique 共享名，为 null 时直接使用备用名
     * @param alt    按节点号命名的备用名
     */
    protected String shared(Node p, String unique, String alt, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        String fn = alt;
        if (unique != null) {
            UniqueNames.Result action = ctx.uniqueNames().signIn(unique);
            if (action == UniqueNames.Result.EXISTS) {
                return unique;
            } else if (action == UniqueNames.Result.MAKE_NEW) {
                fn = unique;
            }
        }
        SourceComments.comment(p, ctx.out());
        FrameCode.functionPrelude(ctx, p, fn);
        ctx.declarations().clear();
        body(p, CompileMode.FUNCTION, units);
        FrameCode.functionPostlude(ctx);
        return fn;
    }

    // ---- 函数体常用片段 ----

    /** 输出已登记的局部变量声明 */
    protected static void declarations(CompilerContext ctx) {
        ctx.declarations().render(ctx.out());
    }

    /** 登记并返回保存栈指针的变量名 */
    protected static String pop(CompilerContext ctx, Node p) {
        String pop = Names.make(Names.PUP, p.getNumber());
        ctx.declarations().declare("ADDR_T", 0, pop);
        return pop;
    }

    /** DECLARE、声明、EXECUTE，然后把值压栈 */
    protected static void pushUnit(Node p, CompilerContext ctx) {
        StagedEmitter emitter = ctx.getEmitter();
        emitter.unit(p, Phase.DECLARE);
        declarations(ctx);
        emitter.unit(p, Phase.EXECUTE);
        emitter.push(p);
    }

    /**
     * 解释器的过程调用约定：取过程值、打开过程帧、执行过程体、传递断点请求、关闭帧。
     *
     * @param fun   过程值变量
     * @param unit  过程体中要执行的单元，例如 {@code NEXT_NEXT (body)}
     * @param args  在执行前输出实参的回调，可为 null
     * @param pop   关闭帧之前恢复的栈指针变量，可为 null
     */
    protected static void callProcedure(CompilerContext ctx, Node idf, String fun, String unit,
                                        Runnable args, String pop) {
        CodeWriter out = ctx.out();
        FrameCode.getStack(ctx, idf, fun, "A68_PROCEDURE");
        out.indentf("body = SUB (NODE (&BODY (%s)));\n", fun);
        out.indentf("OPEN_PROC_FRAME (body, ENVIRON (%s));\n", fun);
        out.indent("INIT_STATIC_FRAME (body);\n");
        if (args != null) {
            args.run();
        }
        out.indentf("EXECUTE_UNIT_TRACE (%s);\n", unit);
        out.indent("if (A68_FP == A68_MON (finish_frame_pointer)) {\n");
        out.in();
        out.indent("change_masks (TOP_NODE (&A68_JOB), BREAKPOINT_INTERRUPT_MASK, A68_TRUE);\n");
        out.out();
        out.indent("}\n");
        if (pop != null) {
            out.indentf("A68_SP = %s;\n", pop);
        }
        out.indent("CLOSE_FRAME;\n");
    }
}
