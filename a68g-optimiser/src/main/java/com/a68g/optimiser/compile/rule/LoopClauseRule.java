package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.FrameCode;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;

/**
 * 计数循环 {@code FOR i FROM a BY b TO c DO ... OD}，生成 C 的 for 循环。
 * <p>
 * 界限都必须是基本单元，在进入循环前求值一次。WHILE 与 UNTIL 部分不编译。
 */
public final class LoopClauseRule extends AbstractRule {

    public LoopClauseRule() {
        super("loop-clause", 3);
    }

    /** 循环子句的各部分，缺省的部分为 null */
    static final class Parts {
        Node forIdentifier;
        Node from;
        Node by;
        Node to;
        boolean downto;
        Node serial;
    }

    /** 解析循环子句；不能编译的形状返回 null */
    static Parts parse(Node p) {
        Parts parts = new Parts();
        Node q = p.getSub();
        if (q != null && q.is(Attribute.FOR_PART)) {
            parts.forIdentifier = q.nextSub();
            q = q.getNext();
        }
        if (q != null && q.is(Attribute.FROM_PART)) {
            parts.from = q.nextSub();
            q = q.getNext();
        }
        if (q != null && q.is(Attribute.BY_PART)) {
            parts.by = q.nextSub();
            q = q.getNext();
        }
        if (q != null && q.is(Attribute.TO_PART)) {
            if (q.getSub().is(Attribute.DOWNTO_SYMBOL)) {
                parts.downto = true;
            } else if (!q.getSub().is(Attribute.TO_SYMBOL)) {
                return null;
            }
            parts.to = q.nextSub();
            q = q.getNext();
        }
        if (q == null || q.is(Attribute.WHILE_PART)) {
            return null;
        }
        if (!(q.is(Attribute.DO_PART) || q.is(Attribute.ALT_DO_PART))) {
            return null;
        }
        q = q.nextSub();
        parts.serial = q;
        if (q != null && q.is(Attribute.SERIAL_CLAUSE)) {
            q = q.getNext();
        }
        if (q != null && q.is(Attribute.UNTIL_PART)) {
            return null;
        }
        return parts;
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.LOOP_CLAUSE);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        Parts parts = parse(p);
        if (parts == null || parts.serial == null || ClosedClauseRule.hasLabels(parts.serial)) {
            return false;
        }
        for (Node bound : new Node[] {parts.from, parts.by, parts.to}) {
            if (bound != null && !ctx.getClassifier().isBasic(bound)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected void prepare(Node p, UnitCompiler units) {
        units.serialClauses().prepare(parse(p).serial);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make("loop", p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        StagedEmitter emitter = ctx.getEmitter();
        CodeWriter out = ctx.out();
        Parts parts = parse(p);
        Node sc = parts.serial;
        String k = Names.make("k", p.getNumber());
        String z = Names.make("z", p.getNumber());
        String to = Names.make("to", p.getNumber());
        String by = Names.make("by", p.getNumber());
        ctx.declarations().declare("INT_T", 0, k);
        if (parts.forIdentifier != null) {
            ctx.declarations().declare("A68_INT", 1, z);
        }
        emitter.unit(parts.from, Phase.DECLARE);
        emitter.unit(parts.by, Phase.DECLARE);
        emitter.unit(parts.to, Phase.DECLARE);
        if (parts.to != null) {
            ctx.declarations().declare("INT_T", 0, to);
        }
        if (parts.by != null) {
            ctx.declarations().declare("INT_T", 0, by);
        }
        String pop = pop(ctx, p);
        declarations(ctx);
        out.indentf("%s = A68_SP;\n", pop);
        emitter.unit(parts.from, Phase.EXECUTE);
        emitter.unit(parts.by, Phase.EXECUTE);
        emitter.unit(parts.to, Phase.EXECUTE);
        if (parts.by != null) {
            out.indentf("%s = ", by);
            emitter.unit(parts.by, Phase.YIELD);
            out.undent(";\n");
        }
        if (parts.to != null) {
            out.indentf("%s = ", to);
            emitter.unit(parts.to, Phase.YIELD);
            out.undent(";\n");
        }
        out.indentf("OPEN_STATIC_FRAME (_NODE_ (%d));\n", sc.getNumber());
        FrameCode.initStaticFrame(ctx, sc);
        if (parts.forIdentifier != null) {
            out.indentf("%s = (A68_INT *) (FRAME_OBJECT (OFFSET (TAX (_NODE_ (%d)))));\n",
                    z, parts.forIdentifier.getNumber());
        }
        out.indentf("for (%s = ", k);
        if (parts.from == null) {
            out.undent("1");
        } else {
            emitter.unit(parts.from, Phase.YIELD);
        }
        out.undent("; ");
        if (parts.to == null) {
            out.undent("A68_TRUE");
        } else {
            out.undentf("%s %s %s", k, parts.downto ? ">=" : "<=", to);
        }
        out.undent("; ");
        String step = parts.downto ? "-" : "+";
        if (parts.by == null) {
            out.undentf("%s %s%s", k, step, step);
        } else {
            out.undentf("%s %s= %s", k, step, by);
        }
        out.undent(") {\n");
        out.in();
        if (declarationLists(sc.getSub()) > 0) {
            out.indent("// genie_preemptive_gc_heap (p);\n");
        }
        if (parts.forIdentifier != null) {
            out.indentf("_STATUS_ (%s) = INIT_MASK;\n", z);
            out.indentf("_VALUE_ (%s) = %s;\n", z, k);
        }
        units.serialClauses().serial(sc, pop);
        SymbolTable table = sc.getTable();
        boolean clear = table != null && table.getApIncrement() > 0;
        if (clear || FrameCode.needInitialiseFrame(sc)) {
            // 下一轮之前重新初始化帧
            if (parts.to == null) {
                out.indent("if (A68_TRUE) {\n");
            } else {
                out.indentf("if (%s %s %s) {\n", k, parts.downto ? ">" : "<", to);
            }
            out.in();
            if (clear) {
                out.indentf("FRAME_CLEAR (%d);\n", table.getApIncrement());
            }
            if (FrameCode.needInitialiseFrame(sc)) {
                out.indentf("initialise_frame (_NODE_ (%d));\n", sc.getNumber());
            }
            out.out();
            out.indent("}\n");
        }
        out.out();
        out.indent("}\n");
        out.indent("CLOSE_FRAME;\n");
        out.indentf("A68_SP = %s;\n", pop);
    }

    /** 串行子句中声明列表的个数，不进入嵌套的单元 */
    static int declarationLists(Node p) {
        int n = 0;
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.DECLARATION_LIST)) {
                n++;
            } else if (!p.is(Attribute.UNIT)) {
                n += declarationLists(p.getSub());
            }
        }
        return n;
    }
}
