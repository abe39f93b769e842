package org.csu.mathmode.compiler.parser;

import org.csu.mathmode.common.config.MathConfig;
import org.csu.mathmode.common.exception.ParseException;
import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.compiler.classifier.ClassifiedConstituent;
import org.csu.mathmode.compiler.classifier.ConstituentClass;
import org.csu.mathmode.compiler.classifier.ConstituentClassifier;
import org.csu.mathmode.compiler.classifier.Delimiters;
import org.csu.mathmode.compiler.lexer.SyntaxConstituent;
import org.csu.mathmode.compiler.parser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * @author hidyouth
 * @description: 数学表达式语法分析器
 * 采用优先级爬升法，将分类后的节点流转换为表达式树。
 *
 * 结合力从低到高: 并列 < 分式 (/) < 上下标 (_ ^ ') < 阶乘 (!) < 根式前缀 (√) < 定界组/原子
 */
public class MathParser {

    private final List<ClassifiedConstituent> tokens;
    private final MathConfig config;
    private final ConstituentClassifier classifier = new ConstituentClassifier();
    // 当前未闭合的定界符，栈顶为最内层
    private final Deque<OpenDelimiter> delimiters = new ArrayDeque<>();
    private int position = 0;
    private int depth;

    private record OpenDelimiter(ClassifiedConstituent token, boolean call) {
    }

    public MathParser(List<ClassifiedConstituent> tokens) {
        this(tokens, MathConfig.defaults());
    }

    public MathParser(List<ClassifiedConstituent> tokens, MathConfig config) {
        this(tokens, config, 0);
    }

    private MathParser(List<ClassifiedConstituent> tokens, MathConfig config, int depth) {
        this.tokens = tokens;
        this.config = config;
        this.depth = depth;
    }

    /**
     * 分类并解析一个数学模式区间的全部子节点。
     */
    public static ExpressionNode parseConstituents(List<SyntaxConstituent> constituents, MathConfig config) {
        return new MathParser(new ConstituentClassifier().classify(constituents), config).parse();
    }

    public ExpressionNode parse() {
        position = 0;
        ExpressionNode root = parseSequence(currentOffset());
        if (!isAtEnd()) {
            // 顶层只会停在多余的闭定界符上
            ClassifiedConstituent stray = peek();
            throw ParseException.unbalancedDelimiter(stray.literal(), stray.span());
        }
        if (config.debug()) {
            System.out.println("[MathParser] Parsed " + tokens.size() + " constituents into "
                    + root.getClass().getSimpleName() + " @" + root.span());
        }
        return root;
    }

    // ---- 并列 ----

    private ExpressionNode parseSequence(int anchor) {
        List<ExpressionNode> items = new ArrayList<>();
        while (!isAtEnd() && !isTerminator(peek())) {
            if (check(ConstituentClass.SPACE)) {
                items.add(parseSpace());
            } else {
                items.add(parseFraction());
            }
        }
        return sequenceOf(items, anchor);
    }

    private SpaceNode parseSpace() {
        ClassifiedConstituent first = advance();
        Span span = first.span();
        boolean wide = first.literal().length() > 1 || first.literal().contains("\n");
        // 连续空白合并为一个节点
        while (check(ConstituentClass.SPACE)) {
            span = span.join(advance().span());
            wide = true;
        }
        return new SpaceNode(wide ? SpaceKind.WIDE : SpaceKind.TIGHT, span);
    }

    // ---- 分式: 左结合 ----

    private ExpressionNode parseFraction() {
        ExpressionNode left = parseAttach();
        // 左结合链的每一环都多一层嵌套，计入深度
        int links = 0;
        try {
            while (true) {
                int save = position;
                skipSpaces();
                if (!check(ConstituentClass.FRACTION)) {
                    position = save;
                    return left;
                }
                ClassifiedConstituent slash = advance();
                enter(slash);
                links++;
                skipSpaces();
                requireOperand(slash);
                ExpressionNode right = parseAttach();
                left = new FracNode(unparen(left), unparen(right), left.span().join(right.span()));
            }
        } finally {
            depth -= links;
        }
    }

    // ---- 上下标与撇号 ----

    private ExpressionNode parseAttach() {
        ExpressionNode base = parseFactorial();
        ExpressionNode sup = null;
        ExpressionNode sub = null;
        int primes = 0;
        Span primeSpan = null;
        Span span = base.span();
        boolean attached = false;
        boolean inPrimeRun = false;
        while (true) {
            if (check(ConstituentClass.PRIME)) {
                ClassifiedConstituent mark = advance();
                Span prime = mark.span();
                if (primeSpan != null && !inPrimeRun) {
                    // 撇号只能连续书写一次，例如 a'_b' 中的第二段撇号
                    throw ParseException.ambiguousAttachment(mark.literal(), prime);
                }
                inPrimeRun = true;
                primeSpan = primeSpan == null ? prime : primeSpan.join(prime);
                span = span.join(prime);
                primes++;
            } else if (check(ConstituentClass.ATTACH_SUB) || check(ConstituentClass.ATTACH_SUP)) {
                inPrimeRun = false;
                ClassifiedConstituent op = advance();
                ExpressionNode script = parseScript(op);
                Span write = op.span().join(script.span());
                if (op.is(ConstituentClass.ATTACH_SUB)) {
                    if (sub != null) {
                        throw ParseException.ambiguousAttachment(op.literal(), write);
                    }
                    sub = unparen(script);
                } else {
                    if (sup != null) {
                        throw ParseException.ambiguousAttachment(op.literal(), write);
                    }
                    // 显式上标总是覆盖撇号，撇号个数仍保留
                    sup = unparen(script);
                }
                span = span.join(script.span());
            } else {
                break;
            }
            attached = true;
        }
        return attached ? new AttachNode(base, sup, sub, primes, primeSpan, span) : base;
    }

    private ExpressionNode parseScript(ClassifiedConstituent op) {
        skipSpaces();
        requireOperand(op);
        enter(op);
        try {
            return parseFactorial();
        } finally {
            leave();
        }
    }

    // ---- 阶乘 ----

    private ExpressionNode parseFactorial() {
        ExpressionNode operand = parsePrefix();
        int links = 0;
        try {
            while (check(ConstituentClass.FACTORIAL)) {
                ClassifiedConstituent bang = advance();
                enter(bang);
                links++;
                operand = new FactorialNode(operand, operand.span().join(bang.span()));
            }
            return operand;
        } finally {
            depth -= links;
        }
    }

    // ---- 根式前缀 ----

    private ExpressionNode parsePrefix() {
        if (!check(ConstituentClass.ROOT)) {
            return parsePostfix();
        }
        ClassifiedConstituent glyph = advance();
        enter(glyph);
        try {
            ExpressionNode index = impliedIndex(glyph);
            if (index == null && check(ConstituentClass.OPENING) && "[".equals(peek().canonical())) {
                index = tryParseIndex();
            }
            skipSpaces();
            requireOperand(glyph);
            ExpressionNode radicand = parsePrefix();
            return new RootNode(unparen(radicand), index, glyph.span().join(radicand.span()));
        } finally {
            leave();
        }
    }

    private ExpressionNode impliedIndex(ClassifiedConstituent glyph) {
        return switch (glyph.canonical()) {
            case "∛" -> new AtomNode("3", AtomKind.NUMBER, glyph.span());
            case "∜" -> new AtomNode("4", AtomKind.NUMBER, glyph.span());
            default -> null;
        };
    }

    /**
     * √[n]x: 紧跟根号的方括号组，只有在其后紧接另一个操作数时才是根指数，
     * 否则回退，方括号组本身作为被开方数。
     */
    private ExpressionNode tryParseIndex() {
        int save = position;
        GroupNode bracket = parseGroup();
        if (startsOperand()) {
            return bracket.body();
        }
        position = save;
        return null;
    }

    // ---- 字段访问与函数调用 ----

    private ExpressionNode parsePostfix() {
        ExpressionNode node = parsePrimary();
        int links = 0;
        try {
            while (true) {
                if (isFieldTarget(node) && peek().isSymbol(".") && isIdentifier(peekAt(1))) {
                    enter(advance()); // consume '.'
                    links++;
                    ClassifiedConstituent field = advance();
                    node = new FieldAccessNode(node, field.canonical(), field.span(), node.span().join(field.span()));
                } else if (isCallee(node) && check(ConstituentClass.OPENING) && "(".equals(peek().canonical())) {
                    node = parseCall(node);
                } else {
                    return node;
                }
            }
        } finally {
            depth -= links;
        }
    }

    private boolean isFieldTarget(ExpressionNode node) {
        if (isAtEnd()) {
            return false;
        }
        if (node instanceof AtomNode atom) {
            return atom.isResolvable();
        }
        return node instanceof FieldAccessNode || node instanceof GroupNode;
    }

    /**
     * 多字符标识符 (非具名字形) 紧跟 '(' 才构成调用；单字符如 f(x) 是并列。
     */
    private boolean isCallee(ExpressionNode node) {
        if (isAtEnd()) {
            return false;
        }
        if (node instanceof AtomNode atom) {
            return atom.isResolvable() && !SymbolNames.isSymbolName(atom.text());
        }
        return node instanceof FieldAccessNode;
    }

    private CallNode parseCall(ExpressionNode callee) {
        ClassifiedConstituent open = advance();
        enter(open);
        delimiters.push(new OpenDelimiter(open, true));
        try {
            List<ExpressionNode> args = new ArrayList<>();
            while (true) {
                ExpressionNode arg = parseArgument();
                if (isAtEnd()) {
                    throw ParseException.unbalancedDelimiter(open.literal(), open.span());
                }
                ClassifiedConstituent next = advance();
                if (next.isSymbol(",")) {
                    args.add(arg);
                    continue;
                }
                if (!next.is(ConstituentClass.CLOSING) || !")".equals(next.canonical())) {
                    throw ParseException.unbalancedDelimiter(next.literal(), next.span());
                }
                // 末尾的空参数 (f() 或 f(a,)) 不计入
                if (!isEmptySequence(arg)) {
                    args.add(arg);
                }
                return new CallNode(callee, args, callee.span().join(next.span()));
            }
        } finally {
            delimiters.pop();
            leave();
        }
    }

    private ExpressionNode parseArgument() {
        skipSpaces();
        ExpressionNode arg = parseSequence(currentOffset());
        if (arg instanceof SequenceNode sequence && !sequence.children().isEmpty()) {
            List<ExpressionNode> items = new ArrayList<>(sequence.children());
            while (!items.isEmpty() && items.get(items.size() - 1) instanceof SpaceNode) {
                items.remove(items.size() - 1);
            }
            return sequenceOf(items, sequence.span().start());
        }
        return arg;
    }

    // ---- 原子与定界组 ----

    private ExpressionNode parsePrimary() {
        ClassifiedConstituent token = peek();
        switch (token.tag()) {
            case ATOM:
                advance();
                return new AtomNode(token.canonical(), token.atomKind(), token.span());
            case OPENING:
            case FENCE:
                return parseGroup();
            case GROUP:
                return parseUpstreamGroup();
            case ALIGN_POINT:
                advance();
                return new AlignPointNode(token.span());
            case FACTORIAL:
                // 前面没有操作数的 '!' 只是一个符号
                advance();
                return new AtomNode(token.canonical(), AtomKind.SYMBOL, token.span());
            case ROOT:
                return parsePrefix();
            case CLOSING:
                throw ParseException.unbalancedDelimiter(token.literal(), token.span());
            case ATTACH_SUB:
            case ATTACH_SUP:
            case FRACTION:
            case PRIME:
                throw ParseException.danglingOperator(token.literal(), token.span());
            default:
                throw new IllegalStateException("Unexpected constituent in operand position: " + token);
        }
    }

    private GroupNode parseGroup() {
        ClassifiedConstituent open = advance();
        enter(open);
        delimiters.push(new OpenDelimiter(open, false));
        try {
            ExpressionNode body = parseSequence(open.span().end());
            if (isAtEnd()) {
                throw ParseException.unbalancedDelimiter(open.literal(), open.span());
            }
            ClassifiedConstituent close = peek();
            if (!close.canonical().equals(Delimiters.closerFor(open.canonical()))) {
                throw ParseException.unbalancedDelimiter(close.literal(), close.span());
            }
            advance();
            return new GroupNode(body, delimiter(open), delimiter(close), open.span().join(close.span()));
        } finally {
            delimiters.pop();
            leave();
        }
    }

    /**
     * 上游已组合好的子表达式，透明地解析其子节点，不产生 GroupNode，
     * 只用一个覆盖整个组的 SequenceNode 承载。
     */
    private ExpressionNode parseUpstreamGroup() {
        ClassifiedConstituent group = advance();
        enter(group);
        try {
            MathParser inner = new MathParser(classifier.classify(group.source().children()), config, depth);
            ExpressionNode node = inner.parseSequence(group.span().start());
            if (!inner.isAtEnd()) {
                ClassifiedConstituent stray = inner.peek();
                throw ParseException.unbalancedDelimiter(stray.literal(), stray.span());
            }
            if (node.span().equals(group.span())) {
                return node;
            }
            // 结果区间覆盖整个上游组 (包括花括号等标记)
            List<ExpressionNode> items = node instanceof SequenceNode sequence ? sequence.children() : List.of(node);
            return new SequenceNode(items, group.span());
        } finally {
            leave();
        }
    }

    private Delimiter delimiter(ClassifiedConstituent token) {
        return new Delimiter(token.literal(), token.canonical(), token.span());
    }

    // ---- 辅助方法 ----

    /**
     * 紧贴运算符的圆括号只用于限定操作数范围，不出现在结果中。
     */
    private static ExpressionNode unparen(ExpressionNode node) {
        if (node instanceof GroupNode group && group.isParenthesized()) {
            return group.body();
        }
        return node;
    }

    private static ExpressionNode sequenceOf(List<ExpressionNode> items, int anchor) {
        if (items.isEmpty()) {
            return new SequenceNode(List.of(), Span.of(anchor, anchor));
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        Span span = items.get(0).span().join(items.get(items.size() - 1).span());
        return new SequenceNode(items, span);
    }

    private static boolean isEmptySequence(ExpressionNode node) {
        return node instanceof SequenceNode sequence && sequence.children().isEmpty();
    }

    private boolean isTerminator(ClassifiedConstituent token) {
        if (token.is(ConstituentClass.CLOSING)) {
            return true;
        }
        OpenDelimiter top = delimiters.peek();
        if (top == null) {
            return false;
        }
        if (token.is(ConstituentClass.FENCE) && top.token().is(ConstituentClass.FENCE)
                && top.token().canonical().equals(token.canonical())) {
            return true;
        }
        return top.call() && token.isSymbol(",");
    }

    private boolean startsOperand() {
        if (isAtEnd() || isTerminator(peek())) {
            return false;
        }
        switch (peek().tag()) {
            case ATOM:
            case OPENING:
            case FENCE:
            case GROUP:
            case ROOT:
                return true;
            default:
                return false;
        }
    }

    private void requireOperand(ClassifiedConstituent operator) {
        if (isAtEnd() || isTerminator(peek())) {
            throw ParseException.danglingOperator(operator.literal(), operator.span());
        }
    }

    private boolean isIdentifier(ClassifiedConstituent token) {
        return token != null && token.is(ConstituentClass.ATOM) && token.atomKind() == AtomKind.IDENT;
    }

    private void enter(ClassifiedConstituent token) {
        if (depth >= config.maxNestingDepth()) {
            throw ParseException.nestingTooDeep(token.literal(), token.span());
        }
        depth++;
    }

    private void leave() {
        depth--;
    }

    private void skipSpaces() {
        while (check(ConstituentClass.SPACE)) {
            advance();
        }
    }

    private int currentOffset() {
        if (!isAtEnd()) {
            return peek().span().start();
        }
        return tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).span().end();
    }

    private boolean check(ConstituentClass tag) {
        if (isAtEnd()) return false;
        return peek().is(tag);
    }

    private ClassifiedConstituent advance() {
        return tokens.get(position++);
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private ClassifiedConstituent peek() {
        return tokens.get(position);
    }

    private ClassifiedConstituent peekAt(int offset) {
        int index = position + offset;
        return index < tokens.size() ? tokens.get(index) : null;
    }
}
