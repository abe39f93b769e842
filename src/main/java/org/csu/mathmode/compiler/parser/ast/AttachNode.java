package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * AST 节点: 上下标附着 (e.g., a_b^c, f'')
 * sup 与 sub 可以为 null。primeCount 记录撇号个数，primeSpan 为撇号覆盖的区间 (没有撇号时为 null)。
 * 有显式上标时上标优先，但撇号个数仍然保留。
 */
public record AttachNode(
        ExpressionNode base,
        ExpressionNode sup,
        ExpressionNode sub,
        int primeCount,
        Span primeSpan,
        Span span
) implements ExpressionNode {

    @Override
    public List<ExpressionNode> children() {
        List<ExpressionNode> children = new ArrayList<>(3);
        children.add(base);
        if (sub != null) {
            children.add(sub);
        }
        if (sup != null) {
            children.add(sup);
        }
        children.sort(Comparator.comparingInt(child -> child.span().start()));
        return children;
    }
}
