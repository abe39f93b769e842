package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 节点: 函数调用 (e.g., sin(x), frac(a, b))
 */
public record CallNode(ExpressionNode callee, List<ExpressionNode> args, Span span) implements ExpressionNode {

    public CallNode {
        args = List.copyOf(args);
    }

    @Override
    public List<ExpressionNode> children() {
        List<ExpressionNode> children = new ArrayList<>(args.size() + 1);
        children.add(callee);
        children.addAll(args);
        return children;
    }
}
