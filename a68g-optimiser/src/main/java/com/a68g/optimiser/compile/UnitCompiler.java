package com.a68g.optimiser.compile;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.rule.CallRule;
import com.a68g.optimiser.compile.rule.CastRule;
import com.a68g.optimiser.compile.rule.ClosedClauseRule;
import com.a68g.optimiser.compile.rule.CodeClauseRule;
import com.a68g.optimiser.compile.rule.CollateralClauseRule;
import com.a68g.optimiser.compile.rule.ConditionalClauseRule;
import com.a68g.optimiser.compile.rule.DenotationRule;
import com.a68g.optimiser.compile.rule.DeproceduringRule;
import com.a68g.optimiser.compile.rule.FormulaRule;
import com.a68g.optimiser.compile.rule.IdentifierRule;
import com.a68g.optimiser.compile.rule.IdentityRelationRule;
import com.a68g.optimiser.compile.rule.IntCaseClauseRule;
import com.a68g.optimiser.compile.rule.LoopClauseRule;
import com.a68g.optimiser.compile.rule.SelectionRule;
import com.a68g.optimiser.compile.rule.SliceRule;
import com.a68g.optimiser.compile.rule.UnitingRule;
import com.a68g.optimiser.compile.rule.VoidingAssignationRule;
import com.a68g.optimiser.compile.rule.VoidingCallRule;
import com.a68g.optimiser.compile.rule.VoidingFormulaRule;
import com.a68g.optimiser.compile.rule.VoidingRule;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 单元编译器：按优先级排列的规则链。
 * <p>
 * 包装节点（UNIT、TERTIARY、SECONDARY、PRIMARY、ENCLOSED_CLAUSE）转交给子节点；
 * 其余节点由第一个匹配的规则处理。没有规则能编译的节点保持未标注，由解释器执行。
 */
public final class UnitCompiler {

    private static final Logger LOG = Logger.getLogger(UnitCompiler.class.getName());

    private final CompilerContext ctx;
    private final List<CompileRule> rules = new ArrayList<>();
    private final SerialClauses serialClauses;

    public UnitCompiler(CompilerContext ctx) {
        this.ctx = ctx;
        this.serialClauses = new SerialClauses(this);
    }

    /**
     * 完整规则链，按级别 3、2、1 排列，代码子句在任何级别都编译。
     */
    public static UnitCompiler createDefault(CompilerContext ctx) {
        UnitCompiler units = new UnitCompiler(ctx);
        // 控制结构
        units.addRule(new ClosedClauseRule());
        units.addRule(new CollateralClauseRule());
        units.addRule(new ConditionalClauseRule());
        units.addRule(new IntCaseClauseRule());
        units.addRule(new LoopClauseRule());
        // 简单结构
        units.addRule(new VoidingAssignationRule());
        units.addRule(new SliceRule());
        units.addRule(new SelectionRule());
        units.addRule(new VoidingFormulaRule());
        units.addRule(new DeproceduringRule());
        units.addRule(new VoidingCallRule());
        units.addRule(new IdentityRelationRule());
        units.addRule(new UnitingRule());
        // 最基本的单元
        units.addRule(new VoidingRule());
        units.addRule(new DenotationRule());
        units.addRule(new CastRule());
        units.addRule(new IdentifierRule());
        units.addRule(FormulaRule.full());
        units.addRule(new CallRule());
        units.addRule(new CodeClauseRule());
        return units;
    }

    /**
     * 级别 0：只编译指称、标识符、转换、二元公式与调用，全部生成共享或独立函数。
     */
    public static UnitCompiler createBasic(CompilerContext ctx) {
        UnitCompiler units = new UnitCompiler(ctx);
        units.addRule(new VoidingRule());
        units.addRule(new DenotationRule());
        units.addRule(new CastRule());
        units.addRule(new IdentifierRule());
        units.addRule(FormulaRule.basic());
        units.addRule(new CallRule());
        return units;
    }

    public void addRule(CompileRule rule) {
        rules.add(rule);
    }

    public List<CompileRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public CompilerContext getContext() {
        return ctx;
    }

    public SerialClauses serialClauses() {
        return serialClauses;
    }

    /**
     * 编译一个节点。
     *
     * @return 生成函数名；DRY 与 INLINE 方式下为能编译时的名称；不能编译时为 null
     */
    public String compile(Node p, CompileMode mode) {
        if (p == null || p.getCompileName() != null) {
            return null;
        }
        if (!ctx.enter()) {
            LOG.fine("递归过深，放弃编译 " + p);
            return null;
        }
        try {
            if (isWrapper(p)) {
                return settle(p, compile(p.getSub(), mode), mode);
            }
            for (CompileRule rule : rules) {
                if (rule.getTier() <= ctx.getCodeLevel() && rule.matches(p)) {
                    Node q = rule.subject(p);
                    String fn = settle(q, rule.compile(q, mode, this), mode);
                    // 规则编译的是子节点时，p 也带上同一个函数
                    return q == p ? fn : settle(p, fn, mode);
                }
            }
            return null;
        } finally {
            ctx.leave();
        }
    }

    private static boolean isWrapper(Node p) {
        switch (p.getAttribute()) {
            case UNIT:
            case TERTIARY:
            case SECONDARY:
            case PRIMARY:
            case ENCLOSED_CLAUSE:
                return true;
            default:
                return false;
        }
    }

    /** FUNCTION 方式成功时标注节点，失败时清除编译节点号 */
    private String settle(Node p, String fn, CompileMode mode) {
        if (mode == CompileMode.FUNCTION) {
            if (fn != null) {
                annotate(p, fn);
            } else {
                p.setCompileNode(0);
            }
        }
        return fn;
    }

    private static void annotate(Node p, String fn) {
        p.setCompileName(fn);
        Node sub = p.getSub();
        p.setCompileNode(sub != null && sub.getCompileNode() > 0 ? sub.getCompileNode() : p.getNumber());
    }

    /** 子节点已编译时，把子节点的标注带到 p 上 */
    void inherit(Node p) {
        Node sub = p.getSub();
        if (sub != null && sub.getCompileNode() > 0) {
            p.setCompileNode(sub.getCompileNode());
            p.setCompileName(sub.getCompileName());
        }
    }

    /**
     * 遍历树，在每个 UNIT 与 CODE_CLAUSE 处尝试生成函数；不能编译时进入子树继续。
     */
    public void compileUnits(Node p) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT) || p.is(Attribute.CODE_CLAUSE)) {
                if (compile(p, CompileMode.FUNCTION) == null) {
                    compileUnits(p.getSub());
                } else {
                    inherit(p);
                }
            } else {
                compileUnits(p.getSub());
            }
        }
    }
}
