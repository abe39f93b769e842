package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * AST 节点: 标识符、数字或符号。
 */
public record AtomNode(String text, AtomKind kind, Span span) implements ExpressionNode {

    /**
     * 多字符标识符需要在作用域中解析，单个字母按字面输出。
     */
    public boolean isResolvable() {
        return kind == AtomKind.IDENT && text.codePointCount(0, text.length()) > 1;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
