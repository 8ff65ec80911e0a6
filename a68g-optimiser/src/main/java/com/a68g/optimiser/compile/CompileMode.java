package com.a68g.optimiser.compile;

/**
 * 编译方式。
 */
public enum CompileMode {
    /** 只判定能否编译，不输出、不标注 */
    DRY,
    /** 输出到调用方当前的生成函数中，不标注 */
    INLINE,
    /** 输出独立的生成函数并标注节点 */
    FUNCTION
}
