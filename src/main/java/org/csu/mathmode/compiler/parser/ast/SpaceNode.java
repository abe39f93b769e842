package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 显式空白，连续空白已合并为一个节点。
 */
public record SpaceNode(SpaceKind kind, Span span) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
