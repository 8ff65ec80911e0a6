package com.a68g.optimiser.emit;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.OptimiserOptions;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;

/**
 * 与解释器帧和调用约定相关的固定代码片段。
 */
public final class FrameCode {

    private FrameCode() {
    }

    /** 文件头：来源、级别、时间戳、头文件与宏 */
    public static void prelude(CompilerContext ctx) {
        OptimiserOptions o = ctx.getOptions();
        CodeWriter out = ctx.out();
        String pkg = o.getPackageName();
        out.indentf("// \"%s\" %s\n", o.getObjectFile(), o.getPackageString());
        out.indentf("// optimiser_level=%d code_level=%d\n", o.getLevel().getTier(), ctx.getCodeLevel());
        out.indentf("// %s\n", o.getStamp());
        out.indentf("\n#include <%s/a68g-config.h>\n", pkg);
        for (String header : new String[] {"a68g", "a68g-genie", "a68g-prelude", "a68g-environ",
                "a68g-lib", "a68g-optimiser", "a68g-frames"}) {
            out.indentf("#include <%s/%s.h>\n", pkg, header);
        }
        out.indent("\n#define _NODE_(n) (A68 (node_register)[n])\n");
        out.indent("#define _STATUS_(z) (STATUS (z))\n");
        out.indent("#define _VALUE_(z) (VALUE (z))\n");
    }

    /** 范围内有匿名例程/格式文本或过程、运算符声明时帧需要初始化 */
    public static boolean needInitialiseFrame(SymbolTable table) {
        return table != null && (table.hasAnonymousTexts() || table.getProcOpDeclarations() > 0);
    }

    public static boolean needInitialiseFrame(Node p) {
        return needInitialiseFrame(p.getTable());
    }

    /** 进入静态帧后的清零、全局帧登记与初始化 */
    public static void initStaticFrame(CompilerContext ctx, Node p) {
        CodeWriter out = ctx.out();
        SymbolTable table = p.getTable();
        if (table != null && table.getApIncrement() > 0) {
            out.indentf("FRAME_CLEAR (%d);\n", table.getApIncrement());
        }
        if (p.getLexLevel() == ctx.getGlobalLevel()) {
            out.indent("A68_GLOBALS = A68_FP;\n");
        }
        if (needInitialiseFrame(p)) {
            out.indentf("initialise_frame (_NODE_ (%d));\n", p.getNumber());
        }
    }

    /** 从帧中取标识符的值；快速级别下全局层直接寻址 */
    public static void getStack(CompilerContext ctx, Node idf, String dst, String cast) {
        int level = idf.getTag().getLevel();
        int offset = idf.getTag().getOffset();
        if (ctx.getCodeLevel() >= 4 && level == ctx.getGlobalLevel()) {
            ctx.out().indentf("GET_GLOBAL (%s, %s, %d);\n", dst, cast, offset);
        } else {
            ctx.out().indentf("GET_FRAME (%s, %s, %d, %d);\n", dst, cast, level, offset);
        }
    }

    /** 检查模式下，取出的值未初始化时报运行时错误 */
    public static void checkInit(CompilerContext ctx, Node p, String idf) {
        Mode m = p.getMode();
        if (!ctx.isCheck() || !ctx.getClassifier().folderMode(m)) {
            return;
        }
        CodeWriter out = ctx.out();
        if (m == Mode.COMPLEX) {
            out.indentf("if (!(INITIALISED (&(*%s)[0]) && INITIALISED (&(*%s)[1]))) {\n", idf, idf);
        } else {
            out.indentf("if (!INITIALISED(%s)) {\n", idf);
        }
        out.in();
        out.indentf("diagnostic (A68_RUNTIME_ERROR, p, ERROR_EMPTY_VALUE_FROM, %s);\n", Names.internalMode(m));
        out.indent("exit_genie ((p), A68_RUNTIME_ERROR);\n");
        out.out();
        out.indent("}\n");
    }

    /** 生成函数入口 */
    public static void functionPrelude(CompilerContext ctx, Node p, String fn) {
        CodeWriter out = ctx.out();
        out.indentf("\nPROP_T %s (NODE_T *p) {\n", fn);
        out.in();
        out.indent("PROP_T self;\n");
        out.indentf("UNIT (&self) = %s;\n", fn);
        out.indentf("SOURCE (&self) = _NODE_ (%d);\n", p.getNumber());
        ctx.booking().clear();
    }

    /** 生成函数出口 */
    public static void functionPostlude(CompilerContext ctx) {
        CodeWriter out = ctx.out();
        out.indent("return (self);\n");
        out.out();
        ctx.procedureWritten();
        out.indent("}\n");
        ctx.resetScope();
    }
}
