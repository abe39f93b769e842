package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 显式定界的子表达式 (e.g., (a+b), |x|)
 */
public record GroupNode(ExpressionNode body, Delimiter open, Delimiter close, Span span) implements ExpressionNode {

    public boolean isParenthesized() {
        return "(".equals(open.canonical()) && ")".equals(close.canonical());
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(body);
    }
}
