package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;
import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.OptimiserDiagnostic;
import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.analysis.Trees;
import com.a68g.optimiser.fold.CFormat;
import com.a68g.optimiser.fold.ConstantFolder;
import com.a68g.optimiser.fold.Denotations;
import com.a68g.optimiser.primitive.Primitive;
import com.a68g.optimiser.primitive.Value;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Field;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.Tag;

import java.util.Locale;

import static com.a68g.optimiser.analysis.Trees.stemsFrom;

/**
 * 分阶段生成器：把基本单元内联进当前生成函数。
 * <p>
 * 对同一个节点依次调用 DECLARE、EXECUTE、YIELD：
 * <ul>
 *   <li>DECLARE 只登记局部变量</li>
 *   <li>EXECUTE 输出从帧取值、执行原语等语句</li>
 *   <li>YIELD 输出一个无副作用的表达式片段，可以重复调用</li>
 * </ul>
 * 调用顺序由调用方保证。标识符、切片与选择先查预订表，命中时复用已有的局部变量。
 */
public final class StagedEmitter {

    private final CompilerContext ctx;

    public StagedEmitter(CompilerContext ctx) {
        this.ctx = ctx;
    }

    private CodeWriter out() {
        return ctx.out();
    }

    private EligibilityClassifier classifier() {
        return ctx.getClassifier();
    }

    private BookingTable booking() {
        return ctx.booking();
    }

    /** 预订表丢弃条目后同一名称可能再次登记，已声明的跳过 */
    private void declare(String type, int level, String name) {
        if (!ctx.declarations().contains(name)) {
            ctx.declarations().declare(type, level, name);
        }
    }

    private static String idfName(Node idf, int n) {
        return Names.make(Names.sanitise(idf.getSymbol()), n);
    }

    // ================================================================
    // 分派
    // ================================================================

    /** 按节点形状分派 */
    public void unit(Node p, Phase phase) {
        if (p == null) {
            return;
        }
        ConstantFolder folder = ctx.getFolder();
        if (folder.isConstant(p, ctx) && stemsFrom(p, Attribute.DENOTATION) == null) {
            folder.fold(p, phase, ctx);
            return;
        }
        switch (p.getAttribute()) {
            case UNIT:
            case TERTIARY:
            case SECONDARY:
            case PRIMARY:
            case ENCLOSED_CLAUSE:
                unit(p.getSub(), phase);
                return;
            case CLOSED_CLAUSE:
                closed(p, phase);
                return;
            case COLLATERAL_CLAUSE:
                collateral(p, phase);
                return;
            case CONDITIONAL_CLAUSE:
                conditional(p, phase);
                return;
            case WIDENING:
                widening(p, phase);
                return;
            case IDENTIFIER:
                identifier(p, phase);
                return;
            case DEREFERENCING:
                dereferencing(p, phase);
                return;
            case SLICE:
                slice(p, phase);
                return;
            case SELECTION:
                selection(p, phase);
                return;
            case DENOTATION:
                denotation(p, phase);
                return;
            case MONADIC_FORMULA:
                monadicFormula(p, phase);
                return;
            case FORMULA:
                formula(p, phase);
                return;
            case CALL:
                call(p, phase);
                return;
            case CAST:
                unit(p.nextSub(), phase);
                return;
            case IDENTITY_RELATION:
                identityRelation(p, phase);
                return;
            default:
                throw new CodegenException("不能内联的节点", p);
        }
    }

    private void dereferencing(Node p, Phase phase) {
        if (stemsFrom(p.getSub(), Attribute.IDENTIFIER) != null) {
            dereferenceIdentifier(p, phase);
        } else if (stemsFrom(p.getSub(), Attribute.SLICE) != null) {
            Node slice = stemsFrom(p.getSub(), Attribute.SLICE);
            sliceElement(slice, slice.getSub().getMode().getSub().getSub(), phase, SliceForm.DEREFERENCE);
        } else if (stemsFrom(p.getSub(), Attribute.SELECTION) != null) {
            dereferenceSelection(stemsFrom(p.getSub(), Attribute.SELECTION), phase);
        } else {
            throw new CodegenException("不能内联的解引用", p);
        }
    }

    private void slice(Node p, Phase phase) {
        Mode mode = p.getMode();
        Mode rowMode = p.getSub().getMode();
        if (EligibilityClassifier.sameMode(mode, rowMode.getSub())) {
            sliceElement(p, mode, phase, SliceForm.VALUE);
        } else if (mode.isRef() && rowMode.isRef()
                && EligibilityClassifier.sameMode(mode.getSub(), rowMode.getSub().getSub())) {
            sliceElement(p, mode.getSub(), phase, SliceForm.REF_TO_REF);
        } else {
            throw new CodegenException("不能内联的切片 " + rowMode + " -> " + mode, p);
        }
    }

    private void selection(Node p, Phase phase) {
        Mode mode = p.getMode();
        Mode structMode = p.nextSub().getMode();
        if (structMode.isRef() && mode.isRef()) {
            selectionRefToRef(p, phase);
        } else if (structMode.isStruct() && classifier().primitiveMode(mode)) {
            valueSelection(p, phase);
        } else {
            throw new CodegenException("不能内联的选择 " + structMode + " -> " + mode, p);
        }
    }

    // ================================================================
    // 值的写法
    // ================================================================

    /** 指向值的局部指针在表达式中的写法 */
    private void yieldPointer(Mode m, String name, Node p) {
        if (classifier().primitiveMode(m)) {
            out().undentf("_VALUE_ (%s)", name);
        } else if (m == Mode.COMPLEX) {
            out().undentf("(A68_REAL *) (%s)", name);
        } else if (classifier().longMode(m)) {
            out().undentf("(MP_DIGIT_T *) (%s)", name);
        } else if (classifier().basicMode(m)) {
            out().undent(name);
        } else {
            throw new CodegenException("不能内联的模式 " + m, p);
        }
    }

    // ================================================================
    // 指称与扩展
    // ================================================================

    private void denotation(Node p, Phase phase) {
        Mode m = p.getMode();
        if (classifier().longMode(m)) {
            ctx.getFolder().fold(p, phase, ctx);
            return;
        }
        if (phase != Phase.YIELD) {
            return;
        }
        String text = Denotations.text(p);
        try {
            if (m == Mode.INT) {
                Value v = Denotations.value(p);
                out().undent(Long.toString(v.asInt()));
            } else if (m == Mode.REAL) {
                Denotations.parseReal(text);
                out().undent(Denotations.realCode(text));
            } else if (m == Mode.BOOL) {
                Denotations.parseBool(text);
                out().undent("(BOOL_T) A68_" + text.trim().toUpperCase(Locale.ROOT));
            } else if (m == Mode.CHAR) {
                out().undent(CFormat.character(text.isEmpty() ? 0 : text.charAt(0) & 0xff));
            } else if (m == Mode.BITS) {
                out().undent(CFormat.bits(Denotations.parseBits(text)));
            } else {
                throw new CodegenException("不能内联的指称 " + m, p);
            }
        } catch (NumberFormatException e) {
            ctx.report(OptimiserDiagnostic.Severity.ERROR, "error in " + m + " denotation " + text, p);
            ctx.codeError();
            out().undent(ctx.getFolder().zeroLiteral(p, ctx));
        }
    }

    private void widening(Node p, Phase phase) {
        Node sub = p.getSub();
        if (EligibilityClassifier.widensTo(p, Mode.INT, Mode.REAL)) {
            if (phase == Phase.YIELD) {
                out().undent("(REAL_T) (");
                unit(sub, Phase.YIELD);
                out().undent(")");
            } else {
                unit(sub, phase);
            }
        } else if (EligibilityClassifier.widensTo(p, Mode.REAL, Mode.COMPLEX)) {
            String tmp = Names.make(Names.TMP, p.getNumber());
            if (phase == Phase.DECLARE) {
                declare(Names.inlineMode(Mode.COMPLEX), 0, tmp);
                unit(sub, Phase.DECLARE);
            } else if (phase == Phase.EXECUTE) {
                unit(sub, Phase.EXECUTE);
                CodeWriter out = out();
                out.indentf("STATUS_RE (%s) = INIT_MASK;\n", tmp);
                out.indentf("STATUS_IM (%s) = INIT_MASK;\n", tmp);
                out.indentf("RE (%s) = (REAL_T) (", tmp);
                unit(sub, Phase.YIELD);
                out.undent(");\n");
                out.indentf("IM (%s) = 0.0;\n", tmp);
            } else if (phase == Phase.YIELD) {
                out().undentf("(A68_REAL *) %s", tmp);
            }
        } else {
            throw new CodegenException("不能内联的扩展", p);
        }
    }

    // ================================================================
    // 标识符
    // ================================================================

    private void identifier(Node p, Phase phase) {
        Tag tag = p.getTag();
        if (tag == null) {
            throw new CodegenException("标识符没有标签", p);
        }
        // 恒等声明为指称时直接代入
        Node def = tag.getNode();
        if (classifier().primitiveMode(p.getMode()) && def != null && def.getNext() != null
                && def.getNext().is(Attribute.EQUALS_SYMBOL)) {
            Node src = stemsFrom(def.nextNext(), Attribute.DENOTATION);
            if (src != null) {
                denotation(src, phase);
                return;
            }
        }
        if (tag.isStandenv()) {
            if (phase == Phase.YIELD) {
                Primitive prim = classifier().primitive(Primitive.Kind.CONSTANT, p);
                if (prim == null || prim.code(ctx.isCheck()) == null) {
                    throw new CodegenException("没有文本的标准环境常量", p);
                }
                out().undent(prim.code(ctx.isCheck()));
            }
            return;
        }
        Object key = Trees.bookingKey(p);
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.DECL, Phase.DECLARE, key) == null) {
                declare(Names.inlineMode(p.getMode()), 1, idfName(p, p.getNumber()));
                booking().remember(BookAction.DECL, Phase.DECLARE, key, null, p.getNumber());
            }
        } else if (phase == Phase.EXECUTE) {
            if (booking().lookup(BookAction.DECL, Phase.EXECUTE, key) == null) {
                int n = number(booking().lookup(BookAction.DECL, Phase.DECLARE, key), p);
                String idf = idfName(p, n);
                FrameCode.getStack(ctx, p, idf, Names.inlineMode(p.getMode()));
                booking().remember(BookAction.DECL, Phase.EXECUTE, key, null, n);
                FrameCode.checkInit(ctx, p, idf);
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.DECL, Phase.EXECUTE, key), p);
            yieldPointer(p.getMode(), idfName(p, n), p);
        }
    }

    private static int number(BookingTable.Entry entry, Node p) {
        return entry != null ? entry.getNumber() : p.getNumber();
    }

    /** 引用模式的标识符：取出 A68_REF 指针，不解引用 */
    public void refIdentifier(Node p, Phase phase) {
        Object key = Trees.bookingKey(p);
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.DECL, Phase.DECLARE, key) == null) {
                declare("A68_REF", 1, idfName(p, p.getNumber()));
                booking().remember(BookAction.DECL, Phase.DECLARE, key, null, p.getNumber());
            }
        } else if (phase == Phase.EXECUTE) {
            if (booking().lookup(BookAction.DECL, Phase.EXECUTE, key) == null) {
                int n = number(booking().lookup(BookAction.DECL, Phase.DECLARE, key), p);
                FrameCode.getStack(ctx, p, idfName(p, n), "A68_REF");
                booking().remember(BookAction.DECL, Phase.EXECUTE, key, null, n);
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.DECL, Phase.EXECUTE, key), p);
            out().undent(idfName(p, n));
        }
    }

    private void dereferenceIdentifier(Node p, Phase phase) {
        Node q = stemsFrom(p.getSub(), Attribute.IDENTIFIER);
        Object key = Trees.bookingKey(q);
        Mode m = p.getMode();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.DEREF, Phase.DECLARE, key) == null) {
                declare(Names.inlineMode(m), 1, idfName(q, p.getNumber()));
                booking().remember(BookAction.DEREF, Phase.DECLARE, key, null, p.getNumber());
            }
            // 命中时也登记引用：本节点可能先于登记者取值
            unit(p.getSub(), Phase.DECLARE);
        } else if (phase == Phase.EXECUTE) {
            if (booking().lookup(BookAction.DEREF, Phase.EXECUTE, key) == null) {
                int n = number(booking().lookup(BookAction.DEREF, Phase.DECLARE, key), p);
                String idf = idfName(q, n);
                unit(p.getSub(), Phase.EXECUTE);
                fetchValue(idf, m, q, p.getSub());
                booking().remember(BookAction.DEREF, Phase.EXECUTE, key, null, n);
                FrameCode.checkInit(ctx, p, idf);
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.DEREF, Phase.EXECUTE, key), p);
            yieldPointer(m, idfName(q, n), p);
        }
    }

    /**
     * 由名字取值指针：局部地址直接换算，否则经堆解引用。
     *
     * @param ref 产生 A68_REF 的节点，输出它的 YIELD
     */
    public void fetchValue(String dst, Mode m, Node idf, Node ref) {
        CodeWriter out = out();
        String type = Names.inlineMode(m);
        if (idf.getTag() != null && idf.getTag().isLocal()) {
            out.indentf("%s = (%s *) LOCAL_ADDRESS (", dst, type);
        } else {
            out.indentf("%s = DEREF (%s, ", dst, type);
        }
        unit(ref, Phase.YIELD);
        out.undent(");\n");
    }

    // ================================================================
    // 切片
    // ================================================================

    private enum SliceForm { VALUE, DEREFERENCE, REF_TO_REF }

    private void indexer(Node p, Phase phase, int[] k, String tup) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                if (phase != Phase.YIELD) {
                    unit(p, phase);
                } else {
                    out().undentf(k[0] == 0 ? "(SPAN (&%s[%d]) * (" : " + (SPAN (&%s[%d]) * (", tup, k[0]);
                    unit(p, Phase.YIELD);
                    out().undentf(") - SHIFT (&%s[%d]))", tup, k[0]);
                }
                k[0]++;
            } else {
                indexer(p.getSub(), phase, k, tup);
            }
        }
    }

    /**
     * 对行标识符做下标，取得元素。
     * 行描述符（ARRAY）按标识符预订一次，元素（ELEMENT）按下标的结构分别预订。
     */
    private void sliceElement(Node slice, Mode mode, Phase phase, SliceForm form) {
        Node prim = slice.getSub();
        Node indx = prim.getNext();
        Node pidf = stemsFrom(prim, Attribute.IDENTIFIER);
        if (pidf == null) {
            throw new CodegenException("切片的行不是标识符", slice);
        }
        Object key = Trees.bookingKey(pidf);
        int np = prim.getNumber();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.ARRAY, Phase.DECLARE, key) == null) {
                declare("A68_REF", 1, idfName(pidf, np));
                declare("A68_ARRAY", 1, Names.make(Names.ARR, np));
                declare("A68_TUPLE", 1, Names.make(Names.TUP, np));
                booking().remember(BookAction.ARRAY, Phase.DECLARE, key, null, np);
            }
            if (booking().lookup(BookAction.ELEMENT, Phase.DECLARE, key, indx) == null) {
                declare("A68_REF", 0, Names.make(Names.ELM, np));
                declare(Names.inlineMode(mode), 1, Names.make(Names.DRF, np));
                booking().remember(BookAction.ELEMENT, Phase.DECLARE, key, indx, np);
            }
            indexer(indx, Phase.DECLARE, new int[1], null);
        } else if (phase == Phase.EXECUTE) {
            if (booking().lookup(BookAction.ELEMENT, Phase.EXECUTE, key, indx) != null) {
                return;
            }
            CodeWriter out = out();
            int nArr = number(booking().lookup(BookAction.ARRAY, Phase.DECLARE, key), prim);
            String arr = Names.make(Names.ARR, nArr);
            String tup = Names.make(Names.TUP, nArr);
            if (booking().lookup(BookAction.ARRAY, Phase.EXECUTE, key) == null) {
                String idf = idfName(pidf, nArr);
                FrameCode.getStack(ctx, pidf, idf, "A68_REF");
                if (prim.getMode().isRef()) {
                    out.indentf("GET_DESCRIPTOR (%s, %s, DEREF (A68_ROW, %s));\n", arr, tup, idf);
                } else {
                    out.indentf("GET_DESCRIPTOR (%s, %s, (A68_ROW *) %s);\n", arr, tup, idf);
                }
                booking().remember(BookAction.ARRAY, Phase.EXECUTE, key, null, nArr);
            }
            int nElm = number(booking().lookup(BookAction.ELEMENT, Phase.DECLARE, key, indx), prim);
            String elm = Names.make(Names.ELM, nElm);
            out.indentf("%s = ARRAY (%s);\n", elm, arr);
            indexer(indx, Phase.EXECUTE, new int[1], null);
            out.indentf("OFFSET (& %s) += ROW_ELEMENT (%s, ", elm, arr);
            indexer(indx, Phase.YIELD, new int[1], tup);
            out.undent(");\n");
            out.indentf("%s = DEREF (%s, & %s);\n", Names.make(Names.DRF, nElm), Names.inlineMode(mode), elm);
            booking().remember(BookAction.ELEMENT, Phase.EXECUTE, key, indx, nElm);
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.ELEMENT, Phase.EXECUTE, key, indx), prim);
            if (form == SliceForm.REF_TO_REF) {
                out().undentf("(&%s)", Names.make(Names.ELM, n));
            } else {
                yieldPointer(mode, Names.make(Names.DRF, n), slice);
            }
        }
    }

    /**
     * 赋值目标为切片时，元素指针的名称；须在该切片的 EXECUTE 之后调用。
     */
    public String sliceTarget(Node slice) {
        Node prim = slice.getSub();
        Node pidf = stemsFrom(prim, Attribute.IDENTIFIER);
        BookingTable.Entry e = booking().lookup(BookAction.ELEMENT, Phase.EXECUTE, Trees.bookingKey(pidf), prim.getNext());
        return Names.make(Names.DRF, number(e, prim));
    }

    /** 赋值目标切片的分阶段生成，元素模式为 mode */
    public void sliceTarget(Node slice, Mode mode, Phase phase) {
        sliceElement(slice, mode, phase, SliceForm.DEREFERENCE);
    }

    // ================================================================
    // 选择
    // ================================================================

    /** 被选字段的名称 */
    private static String fieldName(Node selection) {
        Node field = selection.getSub();
        if (field.getSub() != null && !field.getSub().getSymbol().isEmpty()) {
            return field.getSub().getSymbol();
        }
        if (!field.getSymbol().isEmpty()) {
            return field.getSymbol();
        }
        Field f = packOf(selection);
        if (f == null) {
            throw new CodegenException("选择没有字段", selection);
        }
        return f.getName();
    }

    private static Field packOf(Node selection) {
        Node field = selection.getSub();
        if (field.getPack() != null) {
            return field.getPack();
        }
        return selection.getPack();
    }

    /** 字段在结构体中的字节偏移 */
    public static int fieldOffset(Node selection) {
        Field f = packOf(selection);
        if (f != null) {
            return f.getOffset();
        }
        Mode m = selection.nextSub().getMode();
        if (m != null && m.isRef()) {
            m = m.getSub();
        }
        String name = fieldName(selection);
        if (m != null && m.isStruct()) {
            for (Field g : m.getFields()) {
                if (g.getName().equals(name)) {
                    return g.getOffset();
                }
            }
        }
        throw new CodegenException("找不到字段 " + name, selection);
    }

    /** 字段的模式：选择结果去掉一层引用 */
    private static Mode fieldMode(Node selection) {
        Mode m = selection.getMode();
        return m != null && m.isRef() ? m.getSub() : m;
    }

    private static Node selectedIdentifier(Node selection) {
        Node idf = stemsFrom(selection.nextSub(), Attribute.IDENTIFIER);
        if (idf == null) {
            throw new CodegenException("选择的结构体不是标识符", selection);
        }
        return idf;
    }

    private void dereferenceSelection(Node selection, Phase phase) {
        Node field = selection.getSub();
        Node idf = selectedIdentifier(selection);
        Mode mode = fieldMode(selection);
        String name = fieldName(selection);
        Object key = Trees.bookingKey(idf);
        int nf = field.getNumber();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.STRUCT, Phase.DECLARE, key) == null) {
                declare("A68_REF", 1, idfName(idf, nf));
                booking().remember(BookAction.STRUCT, Phase.DECLARE, key, null, nf);
            }
            if (booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name) == null) {
                declare(Names.inlineMode(mode), 1, Names.make(Names.SEL, nf));
                booking().remember(BookAction.FIELD, Phase.DECLARE, key, name, nf);
            }
        } else if (phase == Phase.EXECUTE) {
            String ref = structBase(idf, key, nf, "A68_REF");
            if (booking().lookup(BookAction.FIELD, Phase.EXECUTE, key, name) == null) {
                int n = number(booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name), field);
                out().indentf("%s = (%s *) & (ADDRESS (%s)[%d]);\n",
                        Names.make(Names.SEL, n), Names.inlineMode(mode), ref, fieldOffset(selection));
                booking().remember(BookAction.FIELD, Phase.EXECUTE, key, name, n);
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.FIELD, Phase.EXECUTE, key, name), field);
            yieldPointer(mode, Names.make(Names.SEL, n), selection);
        }
    }

    /** 结构体基址只从帧中取一次，返回其名称 */
    private String structBase(Node idf, Object key, int nf, String cast) {
        BookingTable.Entry executed = booking().lookup(BookAction.STRUCT, Phase.EXECUTE, key);
        if (executed != null) {
            return idfName(idf, executed.getNumber());
        }
        int n = number(booking().lookup(BookAction.STRUCT, Phase.DECLARE, key), null, nf);
        String ref = idfName(idf, n);
        FrameCode.getStack(ctx, idf, ref, cast);
        booking().remember(BookAction.STRUCT, Phase.EXECUTE, key, null, n);
        return ref;
    }

    private static int number(BookingTable.Entry entry, Node p, int fallback) {
        return entry != null ? entry.getNumber() : (p != null ? p.getNumber() : fallback);
    }

    private void valueSelection(Node selection, Phase phase) {
        Node field = selection.getSub();
        Node idf = selectedIdentifier(selection);
        Mode mode = selection.getMode();
        String name = fieldName(selection);
        Object key = Trees.bookingKey(idf);
        int nf = field.getNumber();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.STRUCT, Phase.DECLARE, key) == null) {
                declare("A68_STRUCT", 0, idfName(idf, nf));
                booking().remember(BookAction.STRUCT, Phase.DECLARE, key, null, nf);
            }
            if (booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name) == null) {
                declare(Names.inlineMode(mode), 1, Names.make(Names.SEL, nf));
                booking().remember(BookAction.FIELD, Phase.DECLARE, key, name, nf);
            }
        } else if (phase == Phase.EXECUTE) {
            String ref = structBase(idf, key, nf, "BYTE_T");
            if (booking().lookup(BookAction.FIELD, Phase.EXECUTE, key, name) == null) {
                int n = number(booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name), field);
                out().indentf("%s = (%s *) & (%s[%d]);\n",
                        Names.make(Names.SEL, n), Names.inlineMode(mode), ref, fieldOffset(selection));
                booking().remember(BookAction.FIELD, Phase.EXECUTE, key, name, n);
                FrameCode.checkInit(ctx, selection, Names.make(Names.SEL, n));
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.FIELD, Phase.EXECUTE, key, name), field);
            out().undentf("_VALUE_ (%s)", Names.make(Names.SEL, n));
        }
    }

    private void selectionRefToRef(Node selection, Phase phase) {
        Node field = selection.getSub();
        Node idf = selectedIdentifier(selection);
        String name = fieldName(selection);
        Object key = Trees.bookingKey(idf);
        int nf = field.getNumber();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.STRUCT, Phase.DECLARE, key) == null) {
                declare("A68_REF", 1, idfName(idf, nf));
                booking().remember(BookAction.STRUCT, Phase.DECLARE, key, null, nf);
            }
            if (booking().lookup(BookAction.FIELD_REF, Phase.DECLARE, key, name) == null) {
                declare("A68_REF", 0, Names.make(Names.SEL, nf));
                booking().remember(BookAction.FIELD_REF, Phase.DECLARE, key, name, nf);
            }
        } else if (phase == Phase.EXECUTE) {
            String ref = structBase(idf, key, nf, "A68_REF");
            if (booking().lookup(BookAction.FIELD_REF, Phase.EXECUTE, key, name) == null) {
                int n = number(booking().lookup(BookAction.FIELD_REF, Phase.DECLARE, key, name), field);
                String sel = Names.make(Names.SEL, n);
                out().indentf("%s = *%s;\n", sel, ref);
                out().indentf("OFFSET (&%s) += %d;\n", sel, fieldOffset(selection));
                booking().remember(BookAction.FIELD_REF, Phase.EXECUTE, key, name, n);
            }
        } else if (phase == Phase.YIELD) {
            int n = number(booking().lookup(BookAction.FIELD_REF, Phase.EXECUTE, key, name), field);
            out().undentf("(&%s)", Names.make(Names.SEL, n));
        }
    }

    /**
     * 赋值目标为字段选择：DECLARE 登记基址与字段指针，EXECUTE 取出字段指针并返回其名称。
     * 其余阶段返回 null。
     */
    public String selectionTarget(Node selection, Phase phase) {
        Node field = selection.getSub();
        Node idf = selectedIdentifier(selection);
        Mode mode = fieldMode(selection);
        String name = fieldName(selection);
        Object key = Trees.bookingKey(idf);
        int nf = field.getNumber();
        if (phase == Phase.DECLARE) {
            if (booking().lookup(BookAction.STRUCT, Phase.DECLARE, key) == null) {
                declare("A68_REF", 1, idfName(idf, nf));
                booking().remember(BookAction.STRUCT, Phase.DECLARE, key, null, nf);
            }
            if (booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name) == null) {
                declare(Names.inlineMode(mode), 1, Names.make(Names.SEL, nf));
                booking().remember(BookAction.FIELD, Phase.DECLARE, key, name, nf);
            }
            return null;
        } else if (phase == Phase.EXECUTE) {
            String ref = structBase(idf, key, nf, "A68_REF");
            BookingTable.Entry e = booking().lookup(BookAction.FIELD, Phase.EXECUTE, key, name);
            if (e != null) {
                return Names.make(Names.SEL, e.getNumber());
            }
            int n = number(booking().lookup(BookAction.FIELD, Phase.DECLARE, key, name), field);
            String sel = Names.make(Names.SEL, n);
            out().indentf("%s = (%s *) & (ADDRESS (%s)[%d]);\n", sel, Names.inlineMode(mode), ref, fieldOffset(selection));
            booking().remember(BookAction.FIELD, Phase.EXECUTE, key, name, n);
            return sel;
        }
        return null;
    }

    // ================================================================
    // 公式与调用
    // ================================================================

    /** 结果放在临时变量里的模式：COMPLEX 与 LONG */
    private boolean viaTemporary(Mode m) {
        return m == Mode.COMPLEX || classifier().longMode(m);
    }

    private Primitive primitive(Primitive.Kind kind, Node op) {
        Primitive prim = classifier().primitive(kind, op);
        if (prim == null || prim.code(ctx.isCheck()) == null) {
            throw new CodegenException("不在原语表中: " + Trees.procedureOf(op), op);
        }
        return prim;
    }

    /** 临时变量的目标参数 */
    private String target(Mode m, String tmp) {
        return m == Mode.COMPLEX ? tmp : "p, (MP_DIGIT_T *) " + tmp;
    }

    /** LONG 原语的尾参数 */
    private String digits(Mode m) {
        return m == Mode.COMPLEX ? "" : ", LONG_MP_DIGITS";
    }

    private void monadicFormula(Node p, Phase phase) {
        Node op = p.getSub();
        Node rhs = op.getNext();
        Mode m = p.getMode();
        if (viaTemporary(m)) {
            String tmp = Names.make(Names.TMP, p.getNumber());
            if (phase == Phase.DECLARE) {
                declare(Names.inlineMode(m), 0, tmp);
                unit(rhs, Phase.DECLARE);
            } else if (phase == Phase.EXECUTE) {
                unit(rhs, Phase.EXECUTE);
                out().indentf("%s (%s, ", primitive(Primitive.Kind.MONADIC, op).code(ctx.isCheck()), target(m, tmp));
                unit(rhs, Phase.YIELD);
                out().undentf("%s);\n", digits(m));
            } else if (phase == Phase.YIELD) {
                yieldTemporary(m, tmp);
            }
        } else if (classifier().basicMode(m)) {
            if (phase != Phase.YIELD) {
                unit(rhs, phase);
            } else {
                out().undent(primitive(Primitive.Kind.MONADIC, op).code(ctx.isCheck()));
                out().undent(" (");
                unit(rhs, Phase.YIELD);
                out().undent(")");
            }
        } else {
            throw new CodegenException("不能内联的单目公式", p);
        }
    }

    private void yieldTemporary(Mode m, String tmp) {
        if (m == Mode.COMPLEX) {
            out().undent(tmp);
        } else {
            out().undentf("(MP_DIGIT_T *) %s", tmp);
        }
    }

    private void formula(Node p, Phase phase) {
        Node lhs = p.getSub();
        Node op = lhs.getNext();
        if (op == null) {
            monadicFormula(lhs, phase);
            return;
        }
        Node rhs = op.getNext();
        Mode m = p.getMode();
        if (viaTemporary(m)) {
            String tmp = Names.make(Names.TMP, p.getNumber());
            if (phase == Phase.DECLARE) {
                declare(Names.inlineMode(m), 0, tmp);
                unit(lhs, Phase.DECLARE);
                unit(rhs, Phase.DECLARE);
            } else if (phase == Phase.EXECUTE) {
                unit(lhs, Phase.EXECUTE);
                unit(rhs, Phase.EXECUTE);
                out().indentf("%s (%s, ", primitive(Primitive.Kind.DYADIC, op).code(ctx.isCheck()), target(m, tmp));
                unit(lhs, Phase.YIELD);
                out().undent(", ");
                unit(rhs, Phase.YIELD);
                out().undentf("%s);\n", digits(m));
            } else if (phase == Phase.YIELD) {
                yieldTemporary(m, tmp);
            }
        } else if (classifier().basicMode(m)) {
            if (phase != Phase.YIELD) {
                unit(lhs, phase);
                unit(rhs, phase);
                return;
            }
            Primitive prim = primitive(Primitive.Kind.DYADIC, op);
            String code = prim.code(ctx.isCheck());
            CodeWriter out = out();
            if (prim.isLong()) {
                // 多精度比较返回 BOOL
                out.undent(code).undent(" (p, ");
                unit(lhs, Phase.YIELD);
                out.undent(", ");
                unit(rhs, Phase.YIELD);
                out.undent(", LONG_MP_DIGITS)");
            } else if (prim.isFunctionLike(ctx.isCheck())) {
                out.undent(code).undent(" (");
                unit(lhs, Phase.YIELD);
                out.undent(", ");
                unit(rhs, Phase.YIELD);
                out.undent(")");
            } else {
                out.undent("(");
                unit(lhs, Phase.YIELD);
                out.undent(" ").undent(code).undent(" ");
                unit(rhs, Phase.YIELD);
                out.undent(")");
            }
        } else {
            throw new CodegenException("不能内联的公式", p);
        }
    }

    /** 穿过实参列表，对每个实参单元执行一个阶段；YIELD 时以逗号分隔 */
    private void singleArguments(Node p, Phase phase, int[] count) {
        for (; p != null; p = p.getNext()) {
            switch (p.getAttribute()) {
                case ARGUMENT_LIST:
                case ARGUMENT:
                case GENERIC_ARGUMENT_LIST:
                case GENERIC_ARGUMENT:
                    singleArguments(p.getSub(), phase, count);
                    break;
                case UNIT:
                    if (phase == Phase.YIELD && count[0] > 0) {
                        out().undent(", ");
                    }
                    unit(p, phase);
                    count[0]++;
                    break;
                default:
                    break;
            }
        }
    }

    private void call(Node p, Phase phase) {
        Node prim = p.getSub();
        Node args = prim.getNext();
        Node idf = stemsFrom(prim, Attribute.IDENTIFIER);
        Mode m = p.getMode();
        if (viaTemporary(m)) {
            String tmp = Names.make(Names.TMP, p.getNumber());
            if (phase == Phase.DECLARE) {
                declare(Names.inlineMode(m), 0, tmp);
                singleArguments(args, Phase.DECLARE, new int[1]);
            } else if (phase == Phase.EXECUTE) {
                singleArguments(args, Phase.EXECUTE, new int[1]);
                out().indentf("%s (%s, ", primitive(Primitive.Kind.FUNCTION, idf).code(ctx.isCheck()), target(m, tmp));
                singleArguments(args, Phase.YIELD, new int[1]);
                out().undentf("%s);\n", digits(m));
            } else if (phase == Phase.YIELD) {
                yieldTemporary(m, tmp);
            }
        } else if (classifier().basicMode(m)) {
            if (phase != Phase.YIELD) {
                singleArguments(args, phase, new int[1]);
            } else {
                out().undent(primitive(Primitive.Kind.FUNCTION, idf).code(ctx.isCheck()));
                out().undent(" (");
                singleArguments(args, Phase.YIELD, new int[1]);
                out().undent(")");
            }
        } else {
            throw new CodegenException("不能内联的调用", p);
        }
    }

    /**
     * 用户过程调用的实参：依次放入新帧。
     *
     * @param size 已占用的帧字节数，跨调用累加
     */
    public void arguments(Node p, Phase phase, int[] size) {
        for (; p != null; p = p.getNext()) {
            if (!p.is(Attribute.UNIT)) {
                arguments(p.getSub(), phase, size);
                continue;
            }
            Mode m = p.getMode();
            String arg = Names.make(Names.ARG, p.getNumber());
            CodeWriter out = out();
            switch (phase) {
                case DECLARE:
                    declare(Names.inlineMode(m), 1, arg);
                    unit(p, Phase.DECLARE);
                    break;
                case INITIALISE:
                    unit(p, Phase.EXECUTE);
                    break;
                case EXECUTE:
                    out.indentf("%s = (%s *) FRAME_OBJECT (%d);\n", arg, Names.inlineMode(m), size[0]);
                    size[0] += m.getSize();
                    break;
                case YIELD:
                    if (classifier().primitiveMode(m)) {
                        out.indentf("_STATUS_ (%s) = INIT_MASK;\n", arg);
                        out.indentf("_VALUE_ (%s) = ", arg);
                        unit(p, Phase.YIELD);
                        out.undent(";\n");
                    } else if (classifier().basicMode(m)) {
                        out.indentf("MOVE ((void *) %s, (void *) ", arg);
                        unit(p, Phase.YIELD);
                        out.undentf(", %d);\n", m.getSize());
                    }
                    break;
                case PUSH:
                    out.indentf("EXECUTE_UNIT_TRACE (_NODE_ (%d));\n", p.getNumber());
                    break;
                default:
                    break;
            }
        }
    }

    // ================================================================
    // 子句
    // ================================================================

    /** 并列子句各单元的分阶段生成，YIELD 阶段把各单元的值依次压栈 */
    public void collateralUnits(Node p, Phase phase) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                if (phase == Phase.YIELD) {
                    out().indent("PUSH_VALUE (p, ");
                    unit(p.getSub(), Phase.YIELD);
                    out().undentf(", %s);\n", Names.inlineMode(p.getMode()));
                } else {
                    unit(p.getSub(), phase);
                }
            } else {
                collateralUnits(p.getSub(), phase);
            }
        }
    }

    private void collateral(Node p, Phase phase) {
        String dsp = Names.make(Names.DSP, p.getNumber());
        String type = p.getMode() == Mode.COMPLEX ? Names.inlineMode(Mode.REAL) : Names.inlineMode(p.getMode());
        if (phase == Phase.DECLARE) {
            declare(type, 1, dsp);
            collateralUnits(p.nextSub(), Phase.DECLARE);
        } else if (phase == Phase.EXECUTE) {
            out().indentf("%s = (%s *) STACK_TOP;\n", dsp, type);
            collateralUnits(p.nextSub(), Phase.EXECUTE);
            collateralUnits(p.nextSub(), Phase.YIELD);
        } else if (phase == Phase.YIELD) {
            out().undent(dsp);
        }
    }

    private void closed(Node p, Phase phase) {
        Node u = Trees.firstUnit(p.nextSub());
        if (phase != Phase.YIELD) {
            unit(u, phase);
        } else {
            out().undent("(");
            unit(u, Phase.YIELD);
            out().undent(")");
        }
    }

    private void conditional(Node p, Phase phase) {
        Node ifPart = p.getSub();
        if (ifPart == null || !(ifPart.is(Attribute.IF_PART) || ifPart.is(Attribute.OPEN_PART))) {
            throw new CodegenException("条件子句缺少条件部分", p);
        }
        Node thenPart = ifPart.getNext();
        if (thenPart == null || !(thenPart.is(Attribute.THEN_PART) || thenPart.is(Attribute.CHOICE))) {
            throw new CodegenException("条件子句缺少 THEN 部分", p);
        }
        Node elsePart = thenPart.getNext();
        if (elsePart != null && !(elsePart.is(Attribute.ELSE_PART) || elsePart.is(Attribute.CHOICE))) {
            elsePart = null;
        }
        Node c = Trees.firstUnit(ifPart.nextSub());
        Node t = Trees.firstUnit(thenPart.nextSub());
        Node e = elsePart != null ? Trees.firstUnit(elsePart.nextSub()) : null;
        if (phase == Phase.DECLARE || phase == Phase.EXECUTE) {
            unit(c, phase);
            unit(t, phase);
            unit(e, phase);
        } else if (phase == Phase.YIELD) {
            CodeWriter out = out();
            out.undent("(");
            unit(c, Phase.YIELD);
            out.undent(" ? ");
            unit(t, Phase.YIELD);
            out.undent(" : ");
            // 省略的 ELSE 相当于 SKIP，取 THEN 分支的值
            unit(e != null ? e : t, Phase.YIELD);
            out.undent(")");
        }
    }

    // ================================================================
    // 恒等关系
    // ================================================================

    private static boolean refIdentifierUnit(Node p) {
        Node idf = stemsFrom(p, Attribute.IDENTIFIER);
        return idf != null && idf.getMode() != null && idf.getMode().isRef();
    }

    private void identityRelation(Node p, Phase phase) {
        Node lhs = p.getSub();
        Node op = lhs.getNext();
        Node rhs = op.getNext();
        boolean is = op.is(Attribute.IS_SYMBOL);
        Node lidf = stemsFrom(lhs, Attribute.IDENTIFIER);
        CodeWriter out = out();
        if (refIdentifierUnit(lhs) && refIdentifierUnit(rhs)) {
            Node ridf = stemsFrom(rhs, Attribute.IDENTIFIER);
            if (phase == Phase.YIELD) {
                out.undent("ADDRESS (");
                refIdentifier(lidf, Phase.YIELD);
                out.undent(is ? ") == ADDRESS (" : ") != ADDRESS (");
                refIdentifier(ridf, Phase.YIELD);
                out.undent(")");
            } else if (phase == Phase.DECLARE || phase == Phase.EXECUTE) {
                refIdentifier(lidf, phase);
                refIdentifier(ridf, phase);
            }
        } else if (refIdentifierUnit(lhs) && stemsFrom(rhs, Attribute.NIHIL) != null) {
            if (phase == Phase.YIELD) {
                out.undent(is ? "IS_NIL (*" : "!IS_NIL (*");
                refIdentifier(lidf, Phase.YIELD);
                out.undent(")");
            } else if (phase == Phase.DECLARE || phase == Phase.EXECUTE) {
                refIdentifier(lidf, phase);
            }
        } else {
            throw new CodegenException("不能内联的恒等关系", p);
        }
    }

    // ================================================================
    // 压栈与赋值
    // ================================================================

    /** 把单元的值压入解释器栈 */
    public void push(Node p) {
        Mode m = p.getMode();
        CodeWriter out = out();
        if (classifier().primitiveMode(m)) {
            out.indent("PUSH_VALUE (p, ");
            unit(p, Phase.YIELD);
            out.undentf(", %s);\n", Names.inlineMode(m));
        } else if (classifier().basicMode(m)) {
            out.indent("MOVE ((void *) STACK_TOP, (void *) ");
            unit(p, Phase.YIELD);
            out.undentf(", %d);\n", m.getSize());
            out.indentf("A68_SP += %d;\n", m.getSize());
        } else {
            throw new CodegenException("不能压栈的模式 " + m, p);
        }
    }

    /** 把单元的值存入 dst 指向的位置 */
    public void assign(Node p, String dst) {
        Mode m = p.getMode();
        CodeWriter out = out();
        if (classifier().primitiveMode(m)) {
            out.indentf("_STATUS_ (%s) = INIT_MASK;\n", dst);
            out.indentf("_VALUE_ (%s) = ", dst);
            unit(p, Phase.YIELD);
            out.undent(";\n");
        } else if (classifier().basicMode(m)) {
            out.indentf("MOVE ((void *) %s, (void *) ", dst);
            unit(p, Phase.YIELD);
            out.undentf(", %d);\n", m.getSize());
        } else {
            throw new CodegenException("不能赋值的模式 " + m, p);
        }
    }
}
