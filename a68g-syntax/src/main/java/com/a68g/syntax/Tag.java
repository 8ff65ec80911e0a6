package com.a68g.syntax;

/**
 * 名称解析结果：标识符所指向的声明。
 */
public final class Tag {
    private final SymbolTable table;
    private final int offset;
    private Node node;
    private String procedure;
    private boolean local;
    private boolean procDeclaration;

    public Tag(SymbolTable table, int offset) {
        this.table = table;
        this.offset = offset;
    }

    /** 声明所在的符号表 */
    public SymbolTable getTable() { return table; }

    /** 在帧中的字节偏移 */
    public int getOffset() { return offset; }

    /** 定义处节点（DEFINING_IDENTIFIER），标准环境中的名称为 null */
    public Node getNode() { return node; }
    public void setNode(Node node) { this.node = node; }

    /**
     * 标准环境原语的身份，如 "genie_add_int"。
     * 非空即表示这是标准环境中的名称。
     */
    public String getProcedure() { return procedure; }
    public void setProcedure(String procedure) { this.procedure = procedure; }

    public boolean isStandenv() {
        return procedure != null;
    }

    /** 值存放在局部地址（BODY 非空） */
    public boolean isLocal() { return local; }
    public void setLocal(boolean local) { this.local = local; }

    /** 由 PROC 声明引入 */
    public boolean isProcDeclaration() { return procDeclaration; }
    public void setProcDeclaration(boolean procDeclaration) { this.procDeclaration = procDeclaration; }

    /** 声明所在的词法层级 */
    public int getLevel() {
        return table != null ? table.getLevel() : 0;
    }
}
