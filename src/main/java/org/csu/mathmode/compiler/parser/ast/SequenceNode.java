package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 没有运算符的并列 (隐式拼接/乘法)
 */
public record SequenceNode(List<ExpressionNode> children, Span span) implements ExpressionNode {

    public SequenceNode {
        children = List.copyOf(children);
    }
}
