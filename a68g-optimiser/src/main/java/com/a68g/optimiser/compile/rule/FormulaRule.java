package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.emit.Phase;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

/**
 * 公式。
 * <p>
 * 检查模式下，非常量公式的计算前清 errno，压栈后检查数学错误。
 * 完整规则链只检查 REAL 与 COMPLEX；级别 0 的规则只处理二元公式，
 * 另外检查 INT 与 BITS，并对压入的实数值做 CHECK_REAL。
 */
public final class FormulaRule extends AbstractRule {

    private final boolean basic;

    private FormulaRule(String name, boolean basic) {
        super(name, 1);
        this.basic = basic;
    }

    /** 完整规则链中的公式，含一元公式 */
    public static FormulaRule full() {
        return new FormulaRule("formula", false);
    }

    /** 级别 0 的公式，只生成函数 */
    public static FormulaRule basic() {
        return new FormulaRule("basic-formula", true);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.FORMULA) || (!basic && p.is(Attribute.MONADIC_FORMULA));
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        if (!ctx.getClassifier().isBasic(p)) {
            return false;
        }
        return !basic || ctx.getClassifier().folderMode(p.getMode());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getMode(), "_formula"), p.getNumber());
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        CompilerContext ctx = units.getContext();
        CodeWriter out = ctx.out();
        Mode m = p.getMode();
        boolean check = ctx.isCheck() && !ctx.getFolder().isConstant(p, ctx);
        boolean real = m == Mode.REAL || m == Mode.COMPLEX;
        if (check && basic && real) {
            out.indent("A68_REAL * _st_ = (A68_REAL *) STACK_TOP;\n");
        }
        ctx.getEmitter().unit(p, Phase.DECLARE);
        declarations(ctx);
        if (check && (basic || real)) {
            out.indent("errno = 0;\n");
        }
        ctx.getEmitter().unit(p, Phase.EXECUTE);
        ctx.getEmitter().push(p);
        if (!check) {
            return;
        }
        if (real || (basic && (m == Mode.INT || m == Mode.BITS))) {
            out.indentf("MATH_RTE (p, errno != 0, %s, NO_TEXT);\n", Names.internalMode(m));
        }
        if (basic && m == Mode.REAL) {
            out.indent("CHECK_REAL (p, _VALUE_ (_st_));\n");
        } else if (basic && m == Mode.COMPLEX) {
            out.indent("CHECK_REAL (p, _VALUE_ (&(_st_[0])));\n");
            out.indent("CHECK_REAL (p, _VALUE_ (&(_st_[1])));\n");
        }
    }
}
