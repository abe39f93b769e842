package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 分式 (e.g., a/b)
 */
public record FracNode(ExpressionNode num, ExpressionNode denom, Span span) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        return List.of(num, denom);
    }
}
