package com.a68g.optimiser;

import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.FrameCode;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;
import com.a68g.syntax.SyntaxTree;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 优化器入口：对整棵树生成 C 文本并标注编译节点。
 * <p>
 * 每次 {@link #run} 使用新的 {@link CompilerContext}，同一个驱动可以重复使用。
 * 内部一致性错误以 {@link CodegenException} 抛出，此时不产生任何结果。
 */
public final class OptimiserDriver {

    private static final Logger LOG = Logger.getLogger(OptimiserDriver.class.getName());

    private final OptimiserOptions options;

    public OptimiserDriver(OptimiserOptions options) {
        this.options = options;
    }

    public OptimiserOptions getOptions() {
        return options;
    }

    public OptimiserResult run(SyntaxTree tree) {
        return run(tree.getRoot());
    }

    public OptimiserResult run(Node root) {
        CompilerContext ctx = new CompilerContext(options);
        ctx.setGlobalLevel(globalLevel(root));
        FrameCode.prelude(ctx);
        UnitCompiler units = options.getLevel() == OptimisationLevel.OPTIMISE_0
                ? UnitCompiler.createBasic(ctx)
                : UnitCompiler.createDefault(ctx);
        units.compileUnits(root);
        if (ctx.out().getIndentation() != 0) {
            throw new CodegenException("缩进不平衡: " + ctx.out().getIndentation());
        }
        if (ctx.getDepthFallbacks() > 0) {
            LOG.fine("递归过深而放弃的子树: " + ctx.getDepthFallbacks());
        }
        if (ctx.booking().getDropped() > 0) {
            LOG.fine("预订表已满，未登记的条目: " + ctx.booking().getDropped());
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("procedures=%d unique-names=%d code-errors=%d",
                    ctx.getProcedures(), ctx.uniqueNames().size(), ctx.getCodeErrors()));
        }
        return new OptimiserResult(ctx.out().text(), ctx.getDiagnostics(), ctx.getProcedures(),
                ctx.uniqueNames().size(), options.getLevel().getOption());
    }

    /**
     * 程序中最浅的词法层级：源码中（行号非 0）的单元的最小层级；没有这样的单元时为 0。
     */
    static int globalLevel(Node root) {
        int level = globalLevel(root, Integer.MAX_VALUE);
        return level == Integer.MAX_VALUE ? 0 : level;
    }

    private static int globalLevel(Node p, int level) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT) && p.getLocation() != null && p.getLocation().getLine() != 0) {
                level = Math.min(level, p.getLexLevel());
            }
            level = globalLevel(p.getSub(), level);
        }
        return level;
    }
}
