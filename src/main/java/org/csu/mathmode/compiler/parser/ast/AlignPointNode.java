package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 对齐点 (&)
 */
public record AlignPointNode(Span span) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
