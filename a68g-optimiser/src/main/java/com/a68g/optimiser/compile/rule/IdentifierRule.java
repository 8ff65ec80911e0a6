package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.primitive.Primitive;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;
import com.a68g.syntax.Tag;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 标识符与对标识符的解引用。
 * <p>
 * 生成函数时按帧地址（符号表、层级、偏移）共享；标准环境中只有常量可以压栈，
 * cputime 之类实为过程的名字不编译。
 */
public final class IdentifierRule extends AbstractRule {

    public IdentifierRule() {
        super("identifier", 1);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.IDENTIFIER)
                || (p.is(Attribute.DEREFERENCING) && stemsFrom(p.getSub(), Attribute.IDENTIFIER) != null);
    }

    private static Node identifier(Node p) {
        return p.is(Attribute.IDENTIFIER) ? p : stemsFrom(p.getSub(), Attribute.IDENTIFIER);
    }

    private static String prefix(Node p) {
        return p.is(Attribute.DEREFERENCING) ? "deref_REF_" : "";
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        EligibilityClassifier classifier = ctx.getClassifier();
        Tag tag = identifier(p).getTag();
        if (tag == null) {
            return false;
        }
        if (tag.isStandenv() && classifier.primitive(Primitive.Kind.CONSTANT, identifier(p)) == null) {
            return false;
        }
        if (mode == CompileMode.INLINE) {
            return classifier.basicMode(p.getMode());
        }
        return classifier.folderMode(p.getMode());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode(prefix(p), p.getMode(), "_identifier"), p.getNumber());
    }

    @Override
    public String compile(Node p, CompileMode mode, UnitCompiler units) {
        if (mode != CompileMode.FUNCTION || !accepts(p, mode, units.getContext())) {
            return super.compile(p, mode, units);
        }
        String unique = Names.unique(Names.withMode(prefix(p), p.getMode(), "_identifier"), "", address(identifier(p)));
        String alt = Names.make(Names.withMode(prefix(p), p.getMode(), "_identifier_alt"), p.getNumber());
        return shared(p, unique, alt, units);
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        pushUnit(p, units.getContext());
    }

    /** 帧地址构成的名称后缀；标准环境常量没有帧地址，用原语名区分 */
    static String address(Node idf) {
        Tag tag = idf.getTag();
        if (tag.isStandenv()) {
            return Names.sanitise(tag.getProcedure());
        }
        int table = tag.getTable() != null ? tag.getTable().getNumber() : 0;
        return table + "_" + tag.getLevel() + "_" + tag.getOffset();
    }
}
