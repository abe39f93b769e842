package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 阶乘 (e.g., n!)，'!' 总是区间的最后一个字符。
 */
public record FactorialNode(ExpressionNode operand, Span span) implements ExpressionNode {

    public Span bangSpan() {
        return Span.of(span.end() - 1, span.end());
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(operand);
    }
}
