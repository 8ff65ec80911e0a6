package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;

import java.util.Map;
import java.util.TreeMap;

/**
 * 一个生成函数的局部变量声明集合。
 * <p>
 * 先按类型、再按标识符排序；同一类型的所有标识符打印在一行，例如
 * {@code A68_INT * genie_x_12, * genie_y_14;}。同一类型下重复声明标识符是内部错误。
 */
public final class DeclarationSet {

    private final TreeMap<String, TreeMap<String, Integer>> byType = new TreeMap<>();

    /**
     * 登记声明。
     *
     * @param type       C 类型名
     * @param level      指针层数，0 为值
     * @param identifier 变量名
     * @throws CodegenException 同一类型下已有该标识符
     */
    public void declare(String type, int level, String identifier) {
        TreeMap<String, Integer> ids = byType.computeIfAbsent(type, k -> new TreeMap<>());
        if (ids.containsKey(identifier)) {
            throw new CodegenException("重复声明 " + type + " " + identifier);
        }
        ids.put(identifier, level);
    }

    public boolean contains(String identifier) {
        for (TreeMap<String, Integer> ids : byType.values()) {
            if (ids.containsKey(identifier)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return byType.isEmpty();
    }

    public void clear() {
        byType.clear();
    }

    /** 按树序输出全部声明 */
    public void render(CodeWriter out) {
        for (Map.Entry<String, TreeMap<String, Integer>> type : byType.entrySet()) {
            out.indent(type.getKey());
            out.undent(" ");
            boolean comma = false;
            for (Map.Entry<String, Integer> id : type.getValue().entrySet()) {
                if (comma) {
                    out.undent(", ");
                }
                comma = true;
                int level = id.getValue();
                if (level > 0) {
                    out.undent("*".repeat(level));
                    out.undent(" ");
                }
                out.undent(id.getKey());
            }
            out.undent(";\n");
        }
    }

    @Override
    public String toString() {
        CodeWriter w = new CodeWriter();
        render(w);
        return w.text();
    }
}
