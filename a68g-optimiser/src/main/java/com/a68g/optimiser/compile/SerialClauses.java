package com.a68g.optimiser.compile;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.FrameCode;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.SourceComments;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

/**
 * 控制结构中的串行子句。
 * <p>
 * 先用 {@link #prepare} 把其中的单元各自编译为函数，再用 {@link #embed} 在外层函数里
 * 打开静态帧，逐个执行单元，声明交给解释器的声明例程。
 */
public final class SerialClauses {

    private final UnitCompiler units;

    SerialClauses(UnitCompiler units) {
        this.units = units;
    }

    private CompilerContext ctx() {
        return units.getContext();
    }

    // ================================================================
    // 预编译
    // ================================================================

    /**
     * 把串行子句中的单元与声明列表编译为独立函数。
     *
     * @return 声明列表个数
     */
    public int prepare(Node p) {
        int[] decs = new int[1];
        prepare(p, decs);
        return decs[0];
    }

    private void prepare(Node p, int[] decs) {
        for (; p != null && ctx().getCodeErrors() == 0; p = p.getNext()) {
            if (p.is(Attribute.UNIT) || p.is(Attribute.DECLARATION_LIST)) {
                if (p.is(Attribute.DECLARATION_LIST)) {
                    decs[0]++;
                }
                compileOther(p);
            } else {
                prepare(p.getSub(), decs);
            }
        }
    }

    /** 单元编译为函数；不能编译时编译它内部的单元 */
    public void compileOther(Node p) {
        if (units.compile(p, CompileMode.FUNCTION) == null) {
            if (p.is(Attribute.UNIT) && p.getSub() != null && p.getSub().is(Attribute.TERTIARY)) {
                units.compileUnits(p.subSub());
            } else {
                units.compileUnits(p.getSub());
            }
        } else {
            units.inherit(p);
        }
    }

    // ================================================================
    // 嵌入
    // ================================================================

    /** 在静态帧中执行串行子句 */
    public void embed(Node sc, String pop) {
        CodeWriter out = ctx().out();
        out.indentf("OPEN_STATIC_FRAME (_NODE_ (%d));\n", sc.getNumber());
        FrameCode.initStaticFrame(ctx(), sc);
        serial(sc, pop);
        out.indent("CLOSE_FRAME;\n");
    }

    /**
     * 逐个执行串行子句的单元与声明；分号处丢弃非 VOID 单元留在栈上的值。
     */
    public void serial(Node p, String pop) {
        serial(p, pop, new Node[1]);
    }

    private void serial(Node p, String pop, Node[] last) {
        CodeWriter out = ctx().out();
        for (; p != null && ctx().getCodeErrors() == 0; p = p.getNext()) {
            switch (p.getAttribute()) {
                case UNIT:
                    last[0] = p;
                    out.indentf("EXECUTE_UNIT_TRACE (_NODE_ (%d));", p.getNumber());
                    SourceComments.inline(p, out);
                    out.undent("\n");
                    break;
                case SEMI_SYMBOL:
                    if (last[0] == null
                            || (last[0].is(Attribute.UNIT) && last[0].getMode() == Mode.VOID)
                            || last[0].is(Attribute.DECLARATION_LIST)) {
                        break;
                    }
                    out.indentf("A68_SP = %s;\n", pop);
                    break;
                case DECLARATION_LIST:
                    last[0] = p;
                    declarationList(p.getSub(), pop);
                    break;
                default:
                    serial(p.getSub(), pop, last);
                    break;
            }
        }
    }

    /** 声明的第一个子节点的编号，解释器从那里开始执行声明 */
    private static int first(Node p) {
        return p.getSub() != null ? p.getSub().getNumber() : p.getNumber();
    }

    /** 声明交给解释器的声明例程 */
    private void declarationList(Node p, String pop) {
        CodeWriter out = ctx().out();
        for (; p != null; p = p.getNext()) {
            switch (p.getAttribute()) {
                case MODE_DECLARATION:
                case PROCEDURE_DECLARATION:
                case BRIEF_OPERATOR_DECLARATION:
                case PRIORITY_DECLARATION:
                    // 帧初始化时已建立
                    break;
                case OPERATOR_DECLARATION:
                    out.indentf("genie_operator_dec (_NODE_ (%d));", first(p));
                    SourceComments.inline(p, out);
                    out.undent("\n");
                    break;
                case IDENTITY_DECLARATION:
                    out.indentf("genie_identity_dec (_NODE_ (%d));", first(p));
                    SourceComments.inline(p, out);
                    out.undent("\n");
                    break;
                case VARIABLE_DECLARATION: {
                    String declarer = Names.make(Names.DEC, first(p));
                    out.indent("{");
                    SourceComments.inline(p, out);
                    out.undent("\n");
                    out.in();
                    out.indentf("NODE_T *%s = NO_NODE;\n", declarer);
                    out.indentf("genie_variable_dec (_NODE_ (%d), &%s, A68_SP);\n", first(p), declarer);
                    out.indentf("A68_SP = %s;\n", pop);
                    out.out();
                    out.indent("}\n");
                    break;
                }
                case PROCEDURE_VARIABLE_DECLARATION:
                    out.indentf("genie_proc_variable_dec (_NODE_ (%d));", first(p));
                    SourceComments.inline(p, out);
                    out.undent("\n");
                    out.indentf("A68_SP = %s;\n", pop);
                    break;
                default:
                    declarationList(p.getSub(), pop);
                    break;
            }
        }
    }
}
