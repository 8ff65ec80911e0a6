package com.a68g.optimiser;

/**
 * 优化级别。
 * <p>
 * 级别决定启用哪些编译规则：0 只编译基本单元（指称、标识符、公式、调用），
 * 1 起加入单元层规则，2 加入赋值、切片、选择、调用等，3 加入控制结构。
 * 选项串交给外部工具链。
 */
public enum OptimisationLevel {
    OPTIMISE_0(0, "-Og"),
    OPTIMISE_1(1, "-O1"),
    OPTIMISE_2(2, "-O2"),
    OPTIMISE_3(3, "-O3"),
    FAST(3, "-Ofast");

    private final int tier;
    private final String option;

    OptimisationLevel(int tier, String option) {
        this.tier = tier;
        this.option = option;
    }

    /** 规则层级 0..3 */
    public int getTier() {
        return tier;
    }

    /** C 编译器优化选项 */
    public String getOption() {
        return option;
    }

    /**
     * 按数字或名称解析：0..3、fast。
     *
     * @throws IllegalArgumentException 无法识别
     */
    public static OptimisationLevel parse(String text) {
        String t = text.trim().toLowerCase();
        if (t.startsWith("-o")) t = t.substring(2);
        switch (t) {
            case "0": case "g": return OPTIMISE_0;
            case "1": return OPTIMISE_1;
            case "2": return OPTIMISE_2;
            case "3": return OPTIMISE_3;
            case "fast": return FAST;
            default: throw new IllegalArgumentException("无效的优化级别: " + text);
        }
    }
}
