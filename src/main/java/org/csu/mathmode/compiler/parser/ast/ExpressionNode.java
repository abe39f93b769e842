package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.List;

/**
 * 数学表达式树的节点。子节点的区间总是严格位于父节点区间之内。
 */
public interface ExpressionNode {

    Span span();

    /**
     * 直接子节点，按源码顺序。叶子节点返回空列表。
     */
    List<ExpressionNode> children();
}
