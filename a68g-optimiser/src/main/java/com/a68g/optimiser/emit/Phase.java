package com.a68g.optimiser.emit;

/**
 * 分阶段生成的阶段。顺序有意义：预订表查询时，已登记阶段不低于请求阶段即命中。
 */
public enum Phase {
    /** 登记局部变量，不输出语句 */
    DECLARE,
    /** 实参初始化语句 */
    INITIALISE,
    /** 有副作用的语句：从帧取值、执行原语 */
    EXECUTE,
    /** 无副作用的表达式片段，可重复调用 */
    YIELD,
    /** 压栈语句（实参） */
    PUSH;

    /** 登记于本阶段的条目是否满足对 requested 的查询 */
    public boolean covers(Phase requested) {
        return compareTo(requested) >= 0;
    }
}
