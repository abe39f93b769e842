package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 根式前缀运算 (e.g., √x, ∛x, √[n]x)，index 可以为 null。
 */
public record RootNode(ExpressionNode radicand, ExpressionNode index, Span span) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        return index == null ? List.of(radicand) : List.of(index, radicand);
    }
}
