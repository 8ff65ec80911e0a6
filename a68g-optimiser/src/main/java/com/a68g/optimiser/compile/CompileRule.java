package com.a68g.optimiser.compile;

import com.a68g.syntax.Node;

/**
 * 单元编译规则接口。
 * <p>
 * {@link UnitCompiler} 按优先级依次询问 {@link #matches}，第一个匹配的规则负责该节点，
 * 其结果即为最终结果。
 */
public interface CompileRule {

    /**
     * 规则名称（用于日志/调试）。
     */
    String getName();

    /**
     * 启用该规则所需的最低代码级别，0 表示任何级别。
     */
    int getTier();

    /**
     * 节点形状是否归本规则处理；纯判定，无副作用。
     */
    boolean matches(Node p);

    /**
     * 实际编译并标注的节点，通常就是 p 本身。
     */
    default Node subject(Node p) {
        return p;
    }

    /**
     * 编译节点。
     *
     * @return 生成函数名；不能编译时返回 null，此时没有任何输出
     */
    String compile(Node p, CompileMode mode, UnitCompiler units);
}
