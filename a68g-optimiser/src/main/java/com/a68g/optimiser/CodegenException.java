package com.a68g.optimiser;

import com.a68g.syntax.Node;

/**
 * 代码生成内部一致性错误。
 * <p>
 * 表示优化器自身的缺陷而不是输入程序的问题，例如重复声明、过长的函数名、
 * 折叠后暂存栈不为空、到达不支持的节点形状。抛出后整个编译中止，不产生输出。
 */
public class CodegenException extends RuntimeException {
    private final Node node;

    public CodegenException(String message) {
        super(message);
        this.node = null;
    }

    public CodegenException(String message, Node node) {
        super(message);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (node != null) {
            sb.append(" at ").append(node);
            if (node.getLocation().getLine() > 0) {
                sb.append(" (").append(node.getLocation()).append(")");
            }
        }
        return sb.toString();
    }
}
