package org.csu.mathmode.engine;

import org.csu.mathmode.common.exception.EvalException;
import org.csu.mathmode.common.model.Value;
import org.csu.mathmode.common.model.ValueKind;
import org.csu.mathmode.compiler.parser.ast.*;
import org.csu.mathmode.content.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 内容构建器 (数学表达式求值器)。
 * 自底向上遍历表达式树，为每个节点生成内容元素。
 *
 * 除了只读的作用域查找外没有副作用：相同的树和作用域总是产生结构相同的内容，
 * 调用方可以安全地按输入缓存结果。
 */
public class ContentBuilder {

    static final String TIGHT_SPACE = " ";
    static final String WIDE_SPACE = "\u2003";

    private final EvalContext context;

    public ContentBuilder(EvalContext context) {
        this.context = context;
    }

    /**
     * 构建节点并做显示转换。任何子表达式失败都会中止整个构建。
     *
     * @throws EvalException 名称无法解析、字段不存在、值不可调用或参数不合法
     */
    public ContentElement build(ExpressionNode node) {
        return context.getCoercion().display(evaluate(node), node.span());
    }

    /**
     * 求值为一个值。标识符、字段访问与调用产生作用域中的值，其余节点产生内容。
     */
    public Value evaluate(ExpressionNode node) {
        if (node instanceof AtomNode atom && atom.isResolvable()) {
            return context.getResolver().resolve(atom.text(), atom.span());
        }
        if (node instanceof FieldAccessNode access) {
            Value target = evaluate(access.target());
            return context.getResolver().project(target, access.field(), access.fieldSpan());
        }
        if (node instanceof CallNode call) {
            return evaluateCall(call);
        }
        return new Value(buildElement(node));
    }

    private Value evaluateCall(CallNode call) {
        Value callee = evaluate(call.callee());
        if (callee.getKind() != ValueKind.FUNCTION) {
            throw EvalException.notCallable(callee.getKind(), calleeName(call.callee()), call.callee().span());
        }
        List<ContentElement> args = new ArrayList<>(call.args().size());
        for (ExpressionNode arg : call.args()) {
            args.add(build(arg));
        }
        return callee.asFunction().call(args, call.span());
    }

    private ContentElement buildElement(ExpressionNode node) {
        if (node instanceof AtomNode atom) {
            return new TextElement(atom.text(), atom.span());
        }
        if (node instanceof GroupNode group) {
            return new DelimitedElement(group.open().canonical(), build(group.body()), group.close().canonical(), group.span());
        }
        if (node instanceof AttachNode attach) {
            return buildAttach(attach);
        }
        if (node instanceof FracNode frac) {
            return new FracElement(build(frac.num()), build(frac.denom()), frac.span());
        }
        if (node instanceof RootNode root) {
            ContentElement index = root.index() == null ? null : build(root.index());
            return new RootElement(build(root.radicand()), index, root.span());
        }
        if (node instanceof FactorialNode factorial) {
            // 阶乘没有专门的元素，表示为 操作数 + "!"
            return new SequenceElement(List.of(
                    build(factorial.operand()),
                    new TextElement("!", factorial.bangSpan())
            ), factorial.span());
        }
        if (node instanceof AlignPointNode align) {
            return new AlignPointElement(align.span());
        }
        if (node instanceof SpaceNode space) {
            return new TextElement(space.kind() == SpaceKind.WIDE ? WIDE_SPACE : TIGHT_SPACE, space.span());
        }
        if (node instanceof SequenceNode sequence) {
            List<ContentElement> children = new ArrayList<>(sequence.children().size());
            for (ExpressionNode child : sequence.children()) {
                children.add(build(child));
            }
            return new SequenceElement(children, sequence.span());
        }
        throw new UnsupportedOperationException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    private AttachElement buildAttach(AttachNode attach) {
        ContentElement base = build(attach.base());
        ContentElement top = attach.sup() == null ? null : build(attach.sup());
        ContentElement bottom = attach.sub() == null ? null : build(attach.sub());
        PrimesElement primes = null;
        if (top == null && attach.primeCount() > 0) {
            primes = new PrimesElement(attach.primeCount(), attach.primeSpan());
        }
        return new AttachElement(base, top, primes, bottom, attach.span());
    }

    private static String calleeName(ExpressionNode callee) {
        if (callee instanceof AtomNode atom) {
            return atom.text();
        }
        if (callee instanceof FieldAccessNode access) {
            return calleeName(access.target()) + "." + access.field();
        }
        return callee.getClass().getSimpleName();
    }
}
