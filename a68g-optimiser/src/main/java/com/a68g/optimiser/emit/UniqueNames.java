package com.a68g.optimiser.emit;

import java.util.HashSet;
import java.util.Set;

/**
 * 共享函数名登记表，容量固定。
 * <p>
 * 相同的指称或帧地址只生成一个函数；表满后调用方改用按节点号命名的备用函数。
 */
public final class UniqueNames {

    public enum Result {
        /** 已生成过，直接引用 */
        EXISTS,
        /** 已登记，需要生成 */
        MAKE_NEW,
        /** 表已满，需要生成备用函数 */
        MAKE_ALT
    }

    private final int capacity;
    private final Set<String> names = new HashSet<>();

    public UniqueNames(int capacity) {
        this.capacity = capacity;
    }

    public Result signIn(String name) {
        if (names.contains(name)) {
            return Result.EXISTS;
        }
        if (names.size() < capacity) {
            names.add(name);
            return Result.MAKE_NEW;
        }
        return Result.MAKE_ALT;
    }

    public int size() {
        return names.size();
    }

    public void clear() {
        names.clear();
    }
}
