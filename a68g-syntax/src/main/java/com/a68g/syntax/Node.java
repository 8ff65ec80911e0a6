package com.a68g.syntax;

import java.util.List;

/**
 * 语法树节点。
 * <p>
 * 由外部解析器构造并完成模式检查；本项目只写入两个标注字段：
 * 编译函数名 {@link #getCompileName()} 与编译节点号 {@link #getCompileNode()}。
 */
public final class Node {
    private final Attribute attribute;
    private final String symbol;
    private final int number;
    private Mode mode;
    private SourceLocation location = SourceLocation.UNKNOWN;
    private Node sub;
    private Node next;
    private SymbolTable table;
    private Tag tag;
    private Field pack;
    private Mode partialProc;

    // 标注
    private String compileName;
    private int compileNode;

    public Node(Attribute attribute, String symbol, int number) {
        this.attribute = attribute;
        this.symbol = symbol != null ? symbol : "";
        this.number = number;
    }

    public Attribute getAttribute() { return attribute; }
    public String getSymbol() { return symbol; }
    public int getNumber() { return number; }

    public Mode getMode() { return mode; }
    public void setMode(Mode mode) { this.mode = mode; }

    public SourceLocation getLocation() { return location; }
    public void setLocation(SourceLocation location) { this.location = location; }

    public Node getSub() { return sub; }
    public void setSub(Node sub) { this.sub = sub; }

    public Node getNext() { return next; }
    public void setNext(Node next) { this.next = next; }

    public SymbolTable getTable() { return table; }
    public void setTable(SymbolTable table) { this.table = table; }

    public Tag getTag() { return tag; }
    public void setTag(Tag tag) { this.tag = tag; }

    /** 选择（SELECTION）中被选字段 */
    public Field getPack() { return pack; }
    public void setPack(Field pack) { this.pack = pack; }

    /** 部分参数化后的过程模式；未部分参数化时为 null */
    public Mode getPartialProc() { return partialProc; }
    public void setPartialProc(Mode partialProc) { this.partialProc = partialProc; }

    public String getCompileName() { return compileName; }
    public void setCompileName(String compileName) { this.compileName = compileName; }

    public int getCompileNode() { return compileNode; }
    public void setCompileNode(int compileNode) { this.compileNode = compileNode; }

    /** 将子节点串成 sub/next 链 */
    public Node setChildren(List<Node> children) {
        Node prev = null;
        sub = null;
        for (Node c : children) {
            if (prev == null) {
                sub = c;
            } else {
                prev.next = c;
            }
            prev = c;
        }
        return this;
    }

    // ---- 便捷访问 ----

    public boolean is(Attribute a) {
        return attribute == a;
    }

    /** 词法层级 */
    public int getLexLevel() {
        return table != null ? table.getLevel() : 0;
    }

    /** NEXT (SUB (p))：第一个子节点的后继 */
    public Node nextSub() { return sub != null ? sub.next : null; }
    public Node subSub() { return sub != null ? sub.sub : null; }
    /** SUB (NEXT (p))：后继的第一个子节点 */
    public Node subNext() { return next != null ? next.sub : null; }
    public Node nextNext() { return next != null ? next.next : null; }
    public Node nextNextNext() { return next != null && next.next != null ? next.next.next : null; }

    /** 子节点的模式的子模式，即 SUB (MOID (p)) */
    public Mode subMode() {
        return mode != null ? mode.getSub() : null;
    }

    @Override
    public String toString() {
        return attribute + "#" + number + (symbol.isEmpty() ? "" : " '" + symbol + "'");
    }
}
