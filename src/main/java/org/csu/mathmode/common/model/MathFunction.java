package org.csu.mathmode.common.model;

import org.csu.mathmode.content.ContentElement;

import java.util.List;

/**
 * 可在数学模式中调用的函数，例如 sin(x) 或 frac(a, b)。
 * 实现必须是纯函数：相同参数总是产生结构相同的结果。
 */
public interface MathFunction {

    String name();

    /**
     * @param args 已构建完成的参数内容，按书写顺序
     * @param span 整个调用表达式的源码区间
     * @return 调用结果，之后会被显示转换为内容
     * @throws org.csu.mathmode.common.exception.EvalException 参数个数不符等情况
     */
    Value call(List<ContentElement> args, Span span);
}
