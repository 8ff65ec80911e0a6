package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.compile.AbstractRule;
import com.a68g.optimiser.compile.CompileMode;
import com.a68g.optimiser.compile.UnitCompiler;
import com.a68g.optimiser.emit.Names;
import com.a68g.optimiser.fold.CFormat;
import com.a68g.optimiser.fold.Denotations;
import com.a68g.optimiser.primitive.Value;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import java.util.Locale;

/**
 * 指称。生成函数时同值的指称共享一个函数，函数名由值构成。
 */
public final class DenotationRule extends AbstractRule {

    public DenotationRule() {
        super("denotation", 1);
    }

    @Override
    public boolean matches(Node p) {
        return p.is(Attribute.DENOTATION);
    }

    @Override
    protected boolean accepts(Node p, CompileMode mode, CompilerContext ctx) {
        return ctx.getClassifier().primitiveMode(p.getMode());
    }

    @Override
    protected String functionName(Node p) {
        return Names.make(Names.withMode("", p.getMode(), "_denotation"), p.getNumber());
    }

    @Override
    public String compile(Node p, CompileMode mode, UnitCompiler units) {
        if (mode != CompileMode.FUNCTION || !accepts(p, mode, units.getContext())) {
            return super.compile(p, mode, units);
        }
        String ext = valueName(p);
        String unique = ext != null ? Names.unique(Names.withMode("", p.getMode(), "_denotation"), "", ext) : null;
        String alt = Names.make(Names.withMode("", p.getMode(), "_denotation_alt"), p.getNumber());
        return shared(p, unique, alt, units);
    }

    @Override
    protected void body(Node p, CompileMode mode, UnitCompiler units) {
        pushUnit(p, units.getContext());
    }

    /**
     * 由指称的值构成的名称后缀；文本不能解析时返回 null。
     */
    static String valueName(Node p) {
        Mode m = p.getMode();
        Value v;
        try {
            v = Denotations.value(p);
        } catch (NumberFormatException e) {
            return null;
        }
        if (m == Mode.INT) {
            return CFormat.hex(v.asInt()) + "_";
        } else if (m == Mode.REAL) {
            StringBuilder sb = new StringBuilder();
            for (char c : CFormat.real(v.asReal()).toCharArray()) {
                if (Character.isLetterOrDigit(c)) {
                    sb.append(Character.toLowerCase(c));
                } else if (c == '.' || c == '-') {
                    sb.append('_');
                }
            }
            return sb.toString();
        } else if (m == Mode.BOOL) {
            return Denotations.text(p).trim().toUpperCase(Locale.ROOT);
        } else if (m == Mode.CHAR) {
            return String.format("%02x_", v.asChar());
        } else if (m == Mode.BITS) {
            return CFormat.hex(v.asBits()) + "_";
        }
        return null;
    }
}
