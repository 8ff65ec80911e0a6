package com.a68g.optimiser.emit;

/**
 * 预订表条目的动作种类。每种局部变量用自己的种类，避免不同用途的条目互相命中。
 */
public enum BookAction {
    /** 标识符的帧取值（指针） */
    DECL,
    /** 解引用后的值指针，包括赋值目标 */
    DEREF,
    /** 行的描述符：idf、arr、tup */
    ARRAY,
    /** 按下标取得的元素；负载为下标节点，按结构比较 */
    ELEMENT,
    /** 结构体选择的基址 */
    STRUCT,
    /** 结构体字段；负载为字段名 */
    FIELD,
    /** 引用到引用的字段选择；负载为字段名 */
    FIELD_REF,
    /** 已输出初始化声明的折叠常量（COMPLEX、LONG） */
    CONSTANT
}
