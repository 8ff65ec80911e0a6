package com.a68g.optimiser.analysis;

import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法树导航工具。
 */
public final class Trees {

    private Trees() {
    }

    /**
     * 穿过 VOIDING、UNIT、TERTIARY、SECONDARY、PRIMARY 包装层向下查找，
     * 到达的节点属性为 {@code attribute} 时返回该节点，否则返回 null。
     */
    public static Node stemsFrom(Node p, Attribute attribute) {
        while (p != null) {
            switch (p.getAttribute()) {
                case VOIDING:
                case UNIT:
                case TERTIARY:
                case SECONDARY:
                case PRIMARY:
                    p = p.getSub();
                    break;
                default:
                    return p.is(attribute) ? p : null;
            }
        }
        return null;
    }

    /** 两棵子树（连同各自的后继兄弟）按属性与符号逐点相同 */
    public static boolean sameTree(Node l, Node r) {
        while (l != null && r != null) {
            if (l.getAttribute() != r.getAttribute() || !l.getSymbol().equals(r.getSymbol())) {
                return false;
            }
            if (!sameTree(l.getSub(), r.getSub())) {
                return false;
            }
            l = l.getNext();
            r = r.getNext();
        }
        return l == null && r == null;
    }

    /** 前序查找第一个 UNIT，不进入 UNIT 内部 */
    public static Node firstUnit(Node p) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                return p;
            }
            Node q = firstUnit(p.getSub());
            if (q != null) {
                return q;
            }
        }
        return null;
    }

    /** 按源码顺序收集 UNIT（不进入 UNIT 内部） */
    public static List<Node> units(Node p) {
        List<Node> out = new ArrayList<>();
        collectUnits(p, out);
        return out;
    }

    private static void collectUnits(Node p, List<Node> out) {
        for (; p != null; p = p.getNext()) {
            if (p.is(Attribute.UNIT)) {
                out.add(p);
            } else {
                collectUnits(p.getSub(), out);
            }
        }
    }

    /**
     * 预订表中标识符的键：已解析的声明标签；没有标签时退回到符号。
     * 同名但不同声明的标识符不会共享局部变量。
     */
    public static Object bookingKey(Node idf) {
        return idf.getTag() != null ? idf.getTag() : idf.getSymbol();
    }

    /** 标识符所属的标准环境原语，非标准环境名称返回 null */
    public static String procedureOf(Node p) {
        return p != null && p.getTag() != null ? p.getTag().getProcedure() : null;
    }
}
