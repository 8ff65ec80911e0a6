package com.a68g.optimiser.analysis;

import com.a68g.optimiser.primitive.Primitive;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Field;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 判断语法树片段是否“基本”，即能够编译为本地代码。
 * <p>
 * 判定是保守的：返回 false 总是安全的，返回 true 时分阶段生成器必须能完成该节点。
 * 判定随代码级别放宽：
 * <ul>
 *   <li>级别 1：标识符、指称、公式、标准环境函数调用</li>
 *   <li>级别 2：加入赋值、切片、选择、扩展、强制转换、恒等关系</li>
 *   <li>级别 3 及以上：加入闭子句、并列子句、条件子句</li>
 * </ul>
 * 不产生任何诊断。
 */
public final class EligibilityClassifier {

    private final int codeLevel;
    private final boolean longModes;

    public EligibilityClassifier(int codeLevel, boolean longModes) {
        this.codeLevel = codeLevel;
        this.longModes = longModes;
    }

    public int getCodeLevel() {
        return codeLevel;
    }

    public boolean isLongModes() {
        return longModes;
    }

    // ============ 模式 ============

    /** 有直接 C 对应的模式 */
    public boolean primitiveMode(Mode m) {
        return m == Mode.INT || m == Mode.REAL || m == Mode.BOOL || m == Mode.CHAR || m == Mode.BITS;
    }

    /** 启用时的多精度模式 */
    public boolean longMode(Mode m) {
        return longModes && m != null && m.isLong();
    }

    /** 指称可编译的模式 */
    public boolean denotationMode(Mode m) {
        return primitiveMode(m) || longMode(m);
    }

    /** 常量折叠器能处理的模式 */
    public boolean folderMode(Mode m) {
        return primitiveMode(m) || m == Mode.COMPLEX || longMode(m);
    }

    public boolean basicMode(Mode m) {
        if (m == null) {
            return false;
        }
        if (denotationMode(m)) {
            return true;
        }
        if (m.isRef()) {
            Mode sub = m.getSub();
            if (sub.isRef() || sub.isProc()) {
                return false;
            }
            return basicMode(sub);
        }
        if (m.isRow()) {
            return false;
        }
        if (m.isStruct()) {
            return allFieldsPrimitive(m);
        }
        return false;
    }

    public boolean basicModeNonRow(Mode m) {
        if (m == null) {
            return false;
        }
        if (denotationMode(m)) {
            return true;
        }
        if (m.isRef()) {
            Mode sub = m.getSub();
            if (sub.isRef() || sub.isProc()) {
                return false;
            }
            return basicModeNonRow(sub);
        }
        if (m.isStruct()) {
            return allFieldsPrimitive(m);
        }
        return false;
    }

    private boolean allFieldsPrimitive(Mode m) {
        for (Field f : m.getFields()) {
            if (!primitiveMode(f.getMode())) {
                return false;
            }
        }
        return true;
    }

    // ============ 原语表 ============

    /** 在原语表中查找，多精度原语仅在启用时可见 */
    public Primitive primitive(Primitive.Kind kind, Node p) {
        Primitive prim = Primitive.lookup(kind, Trees.procedureOf(p));
        if (prim == null || (prim.isLong() && !longModes)) {
            return null;
        }
        return prim;
    }

    // ============ 子句与片段 ============

    /** 并列子句的各单元都是基本的 */
    public boolean basicCollateral(Node p) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                if (!(basicMode(p.getMode()) && isBasic(p.getSub()))) {
                    return false;
                }
            } else if (!basicCollateral(p.getSub())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 串行子句由基本单元组成。
     *
     * @param want 大于 0 时要求单元总数恰好为 want
     */
    public boolean basicSerial(Node p, int want) {
        int[] count = new int[2];
        countBasicUnits(p, count);
        int total = count[0];
        int good = count[1];
        if (want > 0) {
            return total == want && total == good;
        }
        return total == good;
    }

    private void countBasicUnits(Node p, int[] count) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                count[0]++;
                if (isBasic(p)) {
                    count[1]++;
                }
            } else if (p.is(Attribute.DECLARATION_LIST)) {
                count[0]++;
            } else {
                countBasicUnits(p.getSub(), count);
            }
        }
    }

    public boolean basicIndexer(Node p) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.TRIMMER)) {
                return false;
            } else if (p.is(Attribute.UNIT)) {
                if (!isBasic(p)) {
                    return false;
                }
            } else if (!basicIndexer(p.getSub())) {
                return false;
            }
        }
        return true;
    }

    /** 对标识符所指行做下标，各下标都是基本单元 */
    public boolean basicSlice(Node p) {
        if (p != null && p.is(Attribute.SLICE)) {
            Node prim = p.getSub();
            if (stemsFrom(prim, Attribute.IDENTIFIER) != null) {
                return basicIndexer(prim.getNext());
            }
        }
        return false;
    }

    public boolean basicArgument(Node p) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                if (!(basicMode(p.getMode()) && isBasic(p))) {
                    return false;
                }
            } else if (!basicArgument(p.getSub())) {
                return false;
            }
        }
        return true;
    }

    /** 对已知标准环境函数的完整调用（非部分参数化） */
    public boolean basicCall(Node p) {
        if (p == null || !p.is(Attribute.CALL)) {
            return false;
        }
        Node prim = p.getSub();
        Node idf = stemsFrom(prim, Attribute.IDENTIFIER);
        if (idf == null || idf.getMode() == null) {
            return false;
        }
        if (!sameMode(idf.subMode(), p.getMode())) {
            return false;
        }
        if (primitive(Primitive.Kind.FUNCTION, idf) == null) {
            return false;
        }
        return basicArgument(prim.getNext());
    }

    public boolean basicMonadicFormula(Node p) {
        if (p == null || !p.is(Attribute.MONADIC_FORMULA)) {
            return false;
        }
        Node op = p.getSub();
        if (primitive(Primitive.Kind.MONADIC, op) == null) {
            return false;
        }
        return isBasic(op.getNext());
    }

    public boolean basicFormula(Node p) {
        if (p == null || !p.is(Attribute.FORMULA)) {
            return false;
        }
        Node lhs = p.getSub();
        Node op = lhs.getNext();
        if (op == null) {
            return basicMonadicFormula(lhs);
        }
        if (primitive(Primitive.Kind.DYADIC, op) == null) {
            return false;
        }
        return isBasic(lhs) && isBasic(op.getNext());
    }

    /** 每个分支恰好是一个基本单元的条件子句；p 为 IF_PART 或 OPEN_PART */
    public boolean basicConditional(Node p) {
        if (p == null || !(p.is(Attribute.IF_PART) || p.is(Attribute.OPEN_PART))) {
            return false;
        }
        if (!basicSerial(p.nextSub(), 1)) {
            return false;
        }
        p = p.getNext();
        if (p == null || !(p.is(Attribute.THEN_PART) || p.is(Attribute.CHOICE))) {
            return false;
        }
        if (!basicSerial(p.nextSub(), 1)) {
            return false;
        }
        p = p.getNext();
        if (p == null) {
            return false;
        }
        if (p.is(Attribute.ELSE_PART) || p.is(Attribute.CHOICE)) {
            return basicSerial(p.nextSub(), 1);
        }
        return p.is(Attribute.FI_SYMBOL) || p.is(Attribute.CLOSE_SYMBOL);
    }

    /** INT 到 REAL、REAL 到 COMPLEX 的扩展 */
    public static boolean widensTo(Node p, Mode from, Mode to) {
        return p.getSub() != null && p.getSub().getMode() == from && p.getMode() == to;
    }

    // ============ 单元 ============

    /** 单元是否基本 */
    public boolean isBasic(Node p) {
        if (p == null) {
            return false;
        }
        switch (p.getAttribute()) {
            case UNIT:
            case TERTIARY:
            case SECONDARY:
            case PRIMARY:
            case ENCLOSED_CLAUSE:
                return isBasic(p.getSub());
            default:
                break;
        }
        if (codeLevel >= 3) {
            if (p.is(Attribute.CLOSED_CLAUSE)) {
                return basicSerial(p.nextSub(), 1);
            } else if (p.is(Attribute.COLLATERAL_CLAUSE)) {
                return basicMode(p.getMode()) && basicCollateral(p.nextSub());
            } else if (p.is(Attribute.CONDITIONAL_CLAUSE)) {
                return basicMode(p.getMode()) && basicConditional(p.getSub());
            }
        }
        if (codeLevel >= 2) {
            Boolean level2 = basicLevel2(p);
            if (level2 != null) {
                return level2;
            }
        }
        if (codeLevel >= 1) {
            if (p.is(Attribute.IDENTIFIER)) {
                if (p.getTag() != null && p.getTag().isStandenv()) {
                    return primitive(Primitive.Kind.CONSTANT, p) != null;
                }
                return basicMode(p.getMode());
            } else if (p.is(Attribute.DEREFERENCING) && stemsFrom(p.getSub(), Attribute.IDENTIFIER) != null) {
                return basicMode(p.getMode()) && isBasic(stemsFrom(p.getSub(), Attribute.IDENTIFIER));
            } else if (p.is(Attribute.DENOTATION)) {
                return denotationMode(p.getMode());
            } else if (p.is(Attribute.MONADIC_FORMULA)) {
                return basicMode(p.getMode()) && basicMonadicFormula(p);
            } else if (p.is(Attribute.FORMULA)) {
                return basicMode(p.getMode()) && basicFormula(p);
            } else if (p.is(Attribute.CALL)) {
                return basicMode(p.getMode()) && basicCall(p);
            }
        }
        return false;
    }

    /** 级别 2 的形状；不是级别 2 的形状时返回 null */
    private Boolean basicLevel2(Node p) {
        if (isVoidingAssignation(p)) {
            Node dst = p.subSub();
            Node src = dst.nextNext();
            if (stemsFrom(dst, Attribute.IDENTIFIER) != null) {
                return isBasic(src) && basicModeNonRow(src.getMode());
            } else if (stemsFrom(dst, Attribute.SLICE) != null) {
                Node slice = stemsFrom(dst, Attribute.SLICE);
                return slice.getMode() != null && slice.getMode().isRef()
                        && basicSlice(slice) && isBasic(src) && basicModeNonRow(src.getMode());
            } else if (stemsFrom(dst, Attribute.SELECTION) != null) {
                Node selection = stemsFrom(dst, Attribute.SELECTION);
                return stemsFrom(selection.nextSub(), Attribute.IDENTIFIER) != null
                        && isBasic(src) && basicModeNonRow(dst.getMode());
            }
        }
        switch (p.getAttribute()) {
            case VOIDING:
                return isBasic(p.getSub());
            case DEREFERENCING: {
                Node slice = stemsFrom(p.getSub(), Attribute.SLICE);
                if (slice != null) {
                    return basicMode(p.getMode()) && slice.getSub().getMode() != null
                            && slice.getSub().getMode().isRef() && basicSlice(slice);
                }
                Node selection = stemsFrom(p.getSub(), Attribute.SELECTION);
                if (selection != null) {
                    return primitiveMode(p.getMode()) && isBasic(selection);
                }
                return null;
            }
            case WIDENING:
                if (widensTo(p, Mode.INT, Mode.REAL) || widensTo(p, Mode.REAL, Mode.COMPLEX)) {
                    return isBasic(p.getSub());
                }
                return false;
            case CAST:
                return p.getSub() != null && folderMode(p.getSub().getMode()) && isBasic(p.nextSub());
            case SLICE:
                return basicMode(p.getMode()) && basicSlice(p);
            case SELECTION: {
                Node sec = stemsFrom(p.nextSub(), Attribute.IDENTIFIER);
                return sec != null && basicModeNonRow(sec.getMode());
            }
            case IDENTITY_RELATION: {
                Node lhs = p.getSub();
                Node rhs = lhs.nextNext();
                if (refIdentifier(lhs) && refIdentifier(rhs)) {
                    return true;
                }
                return refIdentifier(lhs) && stemsFrom(rhs, Attribute.NIHIL) != null;
            }
            default:
                return null;
        }
    }

    /** VOIDING 包着 ASSIGNATION */
    public static boolean isVoidingAssignation(Node p) {
        return p != null && p.is(Attribute.VOIDING) && p.getSub() != null && p.getSub().is(Attribute.ASSIGNATION);
    }

    private static boolean refIdentifier(Node p) {
        Node idf = stemsFrom(p, Attribute.IDENTIFIER);
        return idf != null && idf.getMode() != null && idf.getMode().isRef();
    }

    /** 模式相同：标准模式按身份，派生模式按结构 */
    public static boolean sameMode(Mode a, Mode b) {
        return a == b || (a != null && a.equals(b));
    }
}
