package org.csu.mathmode.compiler.lexer;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * 上游语法树中的一个数学模式节点，只读。
 *
 * @param kind     节点种类
 * @param text     字面文本 (转义与字符串为去掉标记后的内容)
 * @param span     源码区间
 * @param children 子节点，仅 GROUP 非空
 */
public record SyntaxConstituent(SyntaxKind kind, String text, Span span, List<SyntaxConstituent> children) {

    public SyntaxConstituent {
        children = List.copyOf(children);
    }

    public static SyntaxConstituent leaf(SyntaxKind kind, String text, Span span) {
        return new SyntaxConstituent(kind, text, span, List.of());
    }

    public static SyntaxConstituent group(List<SyntaxConstituent> children, Span span) {
        return new SyntaxConstituent(SyntaxKind.GROUP, "", span, children);
    }

    @Override
    public String toString() {
        return String.format("%s['%s' @%s]", kind, text, span);
    }
}
