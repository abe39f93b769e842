package org.csu.mathmode;

import org.csu.mathmode.common.config.MathConfig;
import org.csu.mathmode.common.exception.ParseException;
import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.compiler.lexer.MathLexer;
import org.csu.mathmode.compiler.parser.MathParser;
import org.csu.mathmode.compiler.parser.ast.*;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * @author hidyouth
 * @description: MathParser 类的单元测试 (使用 JUnit 4)
 */
public class MathParserTest {

    private ExpressionNode parse(String source) {
        return parse(source, MathConfig.defaults());
    }

    private ExpressionNode parse(String source, MathConfig config) {
        System.out.println("Input math: " + source);
        ExpressionNode tree = MathParser.parseConstituents(new MathLexer(source).tokenize(), config);
        System.out.println("Generated tree: " + tree);
        return tree;
    }

    private ParseException parseFailure(String source) {
        ParseException e = assertThrows(ParseException.class, () -> parse(source));
        System.out.println("Expected error: " + e.getMessage());
        return e;
    }

    private static void assertSpansNested(ExpressionNode node) {
        for (ExpressionNode child : node.children()) {
            assertTrue("child " + child.span() + " should be strictly inside " + node.span(),
                    child.span().strictlyInside(node.span()));
            assertSpansNested(child);
        }
    }

    @Test
    public void testSubscriptAndSuperscriptShareOneAttachment() {
        System.out.println("--- Running test: testSubscriptAndSuperscriptShareOneAttachment ---");
        ExpressionNode node = parse("a_b^c");
        assertTrue(node instanceof AttachNode);
        AttachNode attach = (AttachNode) node;
        assertEquals("a", ((AtomNode) attach.base()).text());
        assertEquals("b", ((AtomNode) attach.sub()).text());
        assertEquals("c", ((AtomNode) attach.sup()).text());
        assertEquals(0, attach.primeCount());
        assertEquals(Span.of(0, 5), attach.span());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testExplicitSuperscriptWinsOverPrimes() {
        System.out.println("--- Running test: testExplicitSuperscriptWinsOverPrimes ---");
        AttachNode attach = (AttachNode) parse("a'^b");
        assertEquals("b", ((AtomNode) attach.sup()).text());
        assertEquals(1, attach.primeCount());
        assertEquals(Span.of(1, 2), attach.primeSpan());

        AttachNode primesOnly = (AttachNode) parse("f''");
        assertNull(primesOnly.sup());
        assertEquals(2, primesOnly.primeCount());
        assertEquals(Span.of(1, 3), primesOnly.primeSpan());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testParenthesizedScriptIsTransparent() {
        System.out.println("--- Running test: testParenthesizedScriptIsTransparent ---");
        AttachNode attach = (AttachNode) parse("e^(i pi)");
        assertTrue(attach.sup() instanceof SequenceNode);
        assertEquals(3, attach.sup().children().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSymbolNameBeforeParenIsJuxtaposition() {
        System.out.println("--- Running test: testSymbolNameBeforeParenIsJuxtaposition ---");
        ExpressionNode node = parse("pi(x)");
        assertTrue(node instanceof SequenceNode);
        assertEquals(2, node.children().size());
        assertEquals("pi", ((AtomNode) node.children().get(0)).text());
        assertTrue(node.children().get(1) instanceof GroupNode);

        // 单字母同样不是调用
        assertTrue(parse("f(x)") instanceof SequenceNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testFunctionNameBeforeParenIsCall() {
        System.out.println("--- Running test: testFunctionNameBeforeParenIsCall ---");
        CallNode call = (CallNode) parse("sin(x)");
        assertEquals("sin", ((AtomNode) call.callee()).text());
        assertEquals(1, call.args().size());
        assertEquals(Span.of(0, 6), call.span());

        CallNode frac = (CallNode) parse("frac(a + 1, b)");
        assertEquals(2, frac.args().size());
        assertTrue(frac.args().get(0) instanceof SequenceNode);
        assertEquals(Span.of(5, 10), frac.args().get(0).span());

        assertEquals(0, ((CallNode) parse("max()")).args().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testFractionOperandParenthesesAreTransparent() {
        System.out.println("--- Running test: testFractionOperandParenthesesAreTransparent ---");
        FracNode frac = (FracNode) parse("(a+b)/c");
        assertTrue(frac.num() instanceof SequenceNode);
        assertEquals(3, frac.num().children().size());
        assertEquals("c", ((AtomNode) frac.denom()).text());

        ExpressionNode node = parse("(a/b)+c");
        assertTrue(node instanceof SequenceNode);
        GroupNode group = (GroupNode) node.children().get(0);
        assertTrue(group.body() instanceof FracNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testFractionIsLeftAssociativeAndAbsorbsSpaces() {
        System.out.println("--- Running test: testFractionIsLeftAssociativeAndAbsorbsSpaces ---");
        FracNode frac = (FracNode) parse("a / b / c");
        assertTrue(frac.num() instanceof FracNode);
        assertEquals("c", ((AtomNode) frac.denom()).text());
        assertEquals(Span.of(0, 9), frac.span());

        // 上下标的结合力高于分式
        FracNode scripted = (FracNode) parse("x^2/y_1");
        assertTrue(scripted.num() instanceof AttachNode);
        assertTrue(scripted.denom() instanceof AttachNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testFactorialTermination() {
        System.out.println("--- Running test: testFactorialTermination ---");
        FactorialNode factorial = (FactorialNode) parse("n!");
        assertEquals("n", ((AtomNode) factorial.operand()).text());
        assertEquals(Span.of(1, 2), factorial.bangSpan());

        ExpressionNode sum = parse("n!+1");
        assertEquals(3, sum.children().size());
        assertTrue(sum.children().get(0) instanceof FactorialNode);
        assertEquals("+", ((AtomNode) sum.children().get(1)).text());

        // 前面有空格的 '!' 只是一个符号
        ExpressionNode spaced = parse("n !");
        assertEquals(AtomKind.SYMBOL, ((AtomNode) spaced.children().get(2)).kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testShorthandAndFenceDelimiters() {
        System.out.println("--- Running test: testShorthandAndFenceDelimiters ---");
        GroupNode brackets = (GroupNode) parse("[|x|]");
        assertEquals("⟦", brackets.open().canonical());
        assertEquals("[|", brackets.open().literal());
        assertEquals("⟧", brackets.close().canonical());

        GroupNode norm = (GroupNode) parse("||v||");
        assertEquals("‖", norm.open().canonical());
        assertEquals("‖", norm.close().canonical());

        GroupNode abs = (GroupNode) parse("|x + y|");
        assertEquals("|", abs.open().canonical());
        assertEquals(Span.of(0, 7), abs.span());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnbalancedDelimiters() {
        System.out.println("--- Running test: testUnbalancedDelimiters ---");
        ParseException unclosed = parseFailure("(a");
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, unclosed.kind());
        assertEquals(Span.of(0, 1), unclosed.span());
        assertEquals("(", unclosed.glyph());

        ParseException stray = parseFailure("a)");
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, stray.kind());
        assertEquals(Span.of(1, 2), stray.span());

        ParseException mismatched = parseFailure("(a]");
        assertEquals("]", mismatched.glyph());
        assertEquals(Span.of(2, 3), mismatched.span());

        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, parseFailure("|x").kind());
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, parseFailure("sin(x").kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnbalancedShorthandDelimiters() {
        System.out.println("--- Running test: testUnbalancedShorthandDelimiters ---");
        ParseException unclosed = parseFailure("[|x");
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, unclosed.kind());
        assertEquals("[|", unclosed.glyph());
        assertEquals(Span.of(0, 2), unclosed.span());

        ParseException stray = parseFailure("x|]");
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, stray.kind());
        assertEquals("|]", stray.glyph());
        assertEquals(Span.of(1, 3), stray.span());

        ParseException norm = parseFailure("||v");
        assertEquals(ParseException.Kind.UNBALANCED_DELIMITER, norm.kind());
        assertEquals("||", norm.glyph());
        assertEquals(Span.of(0, 2), norm.span());

        ParseException mismatched = parseFailure("[|x]");
        assertEquals("]", mismatched.glyph());
        assertEquals(Span.of(3, 4), mismatched.span());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDanglingOperators() {
        System.out.println("--- Running test: testDanglingOperators ---");
        ParseException slash = parseFailure("a/");
        assertEquals(ParseException.Kind.DANGLING_OPERATOR, slash.kind());
        assertEquals(Span.of(1, 2), slash.span());

        ParseException caret = parseFailure("^2");
        assertEquals(ParseException.Kind.DANGLING_OPERATOR, caret.kind());
        assertEquals("^", caret.glyph());

        ParseException inGroup = parseFailure("(a_)");
        assertEquals(ParseException.Kind.DANGLING_OPERATOR, inGroup.kind());
        assertEquals(Span.of(2, 3), inGroup.span());

        assertEquals(ParseException.Kind.DANGLING_OPERATOR, parseFailure("√").kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testAmbiguousAttachment() {
        System.out.println("--- Running test: testAmbiguousAttachment ---");
        ParseException e = parseFailure("a_b_c");
        assertEquals(ParseException.Kind.AMBIGUOUS_ATTACHMENT, e.kind());
        assertEquals(Span.of(3, 5), e.span());
        assertEquals(ParseException.Kind.AMBIGUOUS_ATTACHMENT, parseFailure("a^b^c").kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testPrimesMustBeOneContiguousRun() {
        System.out.println("--- Running test: testPrimesMustBeOneContiguousRun ---");
        ParseException e = parseFailure("a'_b'");
        assertEquals(ParseException.Kind.AMBIGUOUS_ATTACHMENT, e.kind());
        assertEquals("'", e.glyph());
        assertEquals(Span.of(4, 5), e.span());

        AttachNode trailing = (AttachNode) parse("a_b''");
        assertEquals(2, trailing.primeCount());
        assertEquals(Span.of(3, 5), trailing.primeSpan());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRootIndexConvention() {
        System.out.println("--- Running test: testRootIndexConvention ---");
        RootNode square = (RootNode) parse("√x");
        assertNull(square.index());

        RootNode cube = (RootNode) parse("∛x");
        assertEquals("3", ((AtomNode) cube.index()).text());
        assertEquals("4", ((AtomNode) ((RootNode) parse("∜x")).index()).text());

        RootNode indexed = (RootNode) parse("√[n]x");
        assertEquals("n", ((AtomNode) indexed.index()).text());
        assertEquals("x", ((AtomNode) indexed.radicand()).text());

        // 方括号后没有操作数时，方括号组本身是被开方数
        RootNode bracketed = (RootNode) parse("√[x]");
        assertNull(bracketed.index());
        assertEquals("[", ((GroupNode) bracketed.radicand()).open().canonical());

        RootNode paren = (RootNode) parse("√(a+b)");
        assertTrue(paren.radicand() instanceof SequenceNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testFieldAccessChain() {
        System.out.println("--- Running test: testFieldAccessChain ---");
        FieldAccessNode outer = (FieldAccessNode) parse("arrow.r.double");
        assertEquals("double", outer.field());
        FieldAccessNode inner = (FieldAccessNode) outer.target();
        assertEquals("r", inner.field());
        assertEquals(Span.of(6, 7), inner.fieldSpan());
        assertEquals("arrow", ((AtomNode) inner.target()).text());

        // 单字母后的点只是符号
        assertEquals(3, parse("x.y").children().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSpacesCollapseAndClassify() {
        System.out.println("--- Running test: testSpacesCollapseAndClassify ---");
        ExpressionNode tight = parse("a b");
        assertEquals(SpaceKind.TIGHT, ((SpaceNode) tight.children().get(1)).kind());

        ExpressionNode wide = parse("a   b");
        assertEquals(3, wide.children().size());
        assertEquals(SpaceKind.WIDE, ((SpaceNode) wide.children().get(1)).kind());

        ExpressionNode newline = parse("a\nb");
        assertEquals(SpaceKind.WIDE, ((SpaceNode) newline.children().get(1)).kind());

        ExpressionNode aligned = parse("a &= b");
        assertTrue(aligned.children().get(2) instanceof AlignPointNode);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNestingDepthIsBounded() {
        System.out.println("--- Running test: testNestingDepthIsBounded ---");
        MathConfig shallow = MathConfig.defaults().withMaxNestingDepth(3);
        assertNotNull(parse("((a))", shallow));
        ParseException e = assertThrows(ParseException.class, () -> parse("((((a))))", shallow));
        assertEquals(ParseException.Kind.NESTING_TOO_DEEP, e.kind());

        String deep = "(".repeat(5000) + "a" + ")".repeat(5000);
        ParseException deepError = assertThrows(ParseException.class, () -> parse(deep));
        assertEquals(ParseException.Kind.NESTING_TOO_DEEP, deepError.kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testOperatorChainsCountTowardsNestingDepth() {
        System.out.println("--- Running test: testOperatorChainsCountTowardsNestingDepth ---");
        MathConfig shallow = MathConfig.defaults().withMaxNestingDepth(3);
        assertTrue(parse("a/b/c/d", shallow) instanceof FracNode);

        ParseException fraction = assertThrows(ParseException.class, () -> parse("a/b/c/d/e", shallow));
        assertEquals(ParseException.Kind.NESTING_TOO_DEEP, fraction.kind());
        assertEquals("/", fraction.glyph());
        assertEquals(Span.of(7, 8), fraction.span());

        ParseException factorial = assertThrows(ParseException.class, () -> parse("n!!!!", shallow));
        assertEquals(Span.of(4, 5), factorial.span());

        ParseException field = assertThrows(ParseException.class, () -> parse("arrow.r.r.r.r", shallow));
        assertEquals(".", field.glyph());
        assertEquals(Span.of(11, 12), field.span());

        String[] chains = {"a" + "/a".repeat(50000), "n" + "!".repeat(50000), "arrow" + ".r".repeat(50000)};
        for (String chain : chains) {
            ParseException e = assertThrows(ParseException.class, () -> parse(chain));
            assertEquals(ParseException.Kind.NESTING_TOO_DEEP, e.kind());
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testEmptyInputIsEmptySequence() {
        System.out.println("--- Running test: testEmptyInputIsEmptySequence ---");
        ExpressionNode node = parse("");
        assertTrue(node instanceof SequenceNode);
        assertTrue(node.children().isEmpty());
        assertEquals(Span.of(0, 0), node.span());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testChildSpansAreStrictlyNested() {
        System.out.println("--- Running test: testChildSpansAreStrictlyNested ---");
        String[] sources = {
                "√[n](a_i^2 + b') / sin(x)! + arrow.r",
                "sum_(i=1)^n i = (n(n+1))/2",
                "||v|| <= |x| + [|y|]",
                "f''(x) & = lim(h, 0) ∛h",
                "e^(i pi) + 1 = 0",
                "  x^2 + y^2  ",
                " a / b\n",
                "\n[|x|] "
        };
        for (String source : sources) {
            ExpressionNode tree = parse(source);
            // 顶层区间覆盖整个输入，包括首尾空白
            assertEquals(Span.of(0, source.length()), tree.span());
            assertSpansNested(tree);
        }
        System.out.println("Result: Test PASSED.\n");
    }
}
