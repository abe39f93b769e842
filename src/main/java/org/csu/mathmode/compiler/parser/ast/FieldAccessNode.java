package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 字段访问 (e.g., arrow.r)
 */
public record FieldAccessNode(ExpressionNode target, String field, Span fieldSpan, Span span) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        return List.of(target);
    }
}
