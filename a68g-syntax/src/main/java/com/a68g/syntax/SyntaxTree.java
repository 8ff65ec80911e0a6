package com.a68g.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * 一棵完成检查的语法树及其来源信息。
 */
public final class SyntaxTree {
    private final Node root;
    private final String sourceName;

    public SyntaxTree(Node root, String sourceName) {
        this.root = root;
        this.sourceName = sourceName != null ? sourceName : "<unknown>";
    }

    public Node getRoot() { return root; }
    public String getSourceName() { return sourceName; }

    /** 前序遍历所有节点 */
    public List<Node> nodes() {
        List<Node> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    /** 已带编译函数标注的节点（前序） */
    public List<Node> annotatedNodes() {
        List<Node> out = new ArrayList<>();
        for (Node n : nodes()) {
            if (n.getCompileName() != null) out.add(n);
        }
        return out;
    }

    private static void collect(Node p, List<Node> out) {
        for (; p != null; p = p.getNext()) {
            out.add(p);
            collect(p.getSub(), out);
        }
    }
}
