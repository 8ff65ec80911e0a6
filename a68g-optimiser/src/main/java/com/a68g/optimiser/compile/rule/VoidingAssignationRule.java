package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.analysis.Trees;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.BookAction;
import com.a68g.optimiser.emit.BookingTable;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 结果被丢弃的赋值，目标为标识符、行元素或结构字段。
 * <p>
 * 目标指针先按名字取出，源值直接写入；标识符目标的指针按标识符预订，
 * 同一函数中的后续单元可以复用。
 */
public final class VoidingAssignationRule extends AbstractRule {

    public VoidingAssignationRule() {
        super("voiding-assignation", 2);
    }

    @Override
    public boolean matches(Node p) {
        if (!EligibilityClassifier.isVoidingAssignation(p)) {
            return false;
        }
        Node dst = p.subSub();
        return stemsFrom(dst, Attribute.IDENTIFIER) != null
                || stemsFrom(dst, Attribute.SLICE) != null
                || stemsFrom(dst, Attribute.SELECTION) != null;
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return ctx.getClassifier().isBasic(p);
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("void_", p.getSub().getMode(), "_assign"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        Node dst = p.subSub();
        Node src = dst.nextNext();
        if (stemsFrom(dst, Attribute.IDENTIFIER) != null) {
            toIdentifier(p, dst, src, ctx);
        } else if (stemsFrom(dst, Attribute.SLICE) != null) {
            toSlice(p, dst, src, ctx);
        } else {
            toSelection(p, dst, src, ctx);
        }
    }

    private static void toIdentifier(Node p, Node dst, Node src, CompilerContext ctx) {
        StagedEmitter emitter = ctx.getEmitter();
        CodeWriter out = ctx.out();
        Node q = stemsFrom(dst, Attribute.IDENTIFIER);
        Object key = Trees.bookingKey(q);
        BookingTable.Entry declared = ctx.booking().lookup(BookAction.DEREF, Phase.DECLARE, key);
        String idf;
        if (declared == null) {
            idf = Names.make(Names.sanitise(q.getSymbol()), p.getNumber());
            if (!ctx.declarations().contains(idf)) {
                ctx.declarations().declare(Names.inlineMode(dst.subMode()), 1, idf);
            }
            ctx.booking().remember(BookAction.DEREF, Phase.DECLARE, key, null, p.getNumber());
        } else {
            idf = Names.make(Names.sanitise(q.getSymbol()), declared.getNumber());
        }
        emitter.unit(dst, Phase.DECLARE);
        emitter.unit(src, Phase.DECLARE);
        String pop = pop(ctx, p);
        declarations(ctx);
        out.indentf("%s = A68_SP;\n", pop);
        emitter.unit(dst, Phase.EXECUTE);
        if (ctx.booking().lookup(BookAction.DEREF, Phase.EXECUTE, key) == null) {
            emitter.fetchValue(idf, dst.subMode(), q, dst);
            ctx.booking().remember(BookAction.DEREF, Phase.EXECUTE, key, null, p.getNumber());
        }
        emitter.unit(src, Phase.EXECUTE);
        emitter.assign(src, idf);
        out.indentf("A68_SP = %s;\n", pop);
    }

    private static void toSlice(Node p, Node dst, Node src, CompilerContext ctx) {
        StagedEmitter emitter = ctx.getEmitter();
        Node slice = stemsFrom(dst, Attribute.SLICE);
        String pop = pop(ctx, p);
        emitter.sliceTarget(slice, dst.subMode(), Phase.DECLARE);
        emitter.unit(src, Phase.DECLARE);
        declarations(ctx);
        ctx.out().indentf("%s = A68_SP;\n", pop);
        emitter.sliceTarget(slice, dst.subMode(), Phase.EXECUTE);
        String drf = emitter.sliceTarget(slice);
        emitter.unit(src, Phase.EXECUTE);
        emitter.assign(src, drf);
        ctx.out().indentf("A68_SP = %s;\n", pop);
    }

    private static void toSelection(Node p, Node dst, Node src, CompilerContext ctx) {
        StagedEmitter emitter = ctx.getEmitter();
        Node selection = stemsFrom(dst, Attribute.SELECTION);
        String pop = pop(ctx, p);
        emitter.selectionTarget(selection, Phase.DECLARE);
        emitter.unit(src, Phase.DECLARE);
        declarations(ctx);
        ctx.out().indentf("%s = A68_SP;\n", pop);
        String sel = emitter.selectionTarget(selection, Phase.EXECUTE);
        emitter.unit(src, Phase.EXECUTE);
        emitter.assign(src, sel);
        ctx.out().indentf("A68_SP = %s;\n", pop);
    }
}
