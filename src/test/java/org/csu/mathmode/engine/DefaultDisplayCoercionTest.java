package org.csu.mathmode.engine;

import org.csu.mathmode.common.model.MathModule;
import org.csu.mathmode.common.model.MathSymbol;
import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.Value;
import org.csu.mathmode.content.SequenceElement;
import org.csu.mathmode.content.TextElement;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DefaultDisplayCoercionTest {

    private final DefaultDisplayCoercion coercion = new DefaultDisplayCoercion();
    private final Span span = Span.of(2, 5);

    @Test
    void testNumbers() {
        assertEquals(new TextElement("2", span), coercion.display(new Value(2.0), span));
        assertEquals(new TextElement("0.25", span), coercion.display(new Value(0.25), span));
        assertEquals(new TextElement("1.5", span), coercion.display(new Value(new BigDecimal("1.500")), span));
        assertEquals(new TextElement("42", span), coercion.display(new Value(42L), span));
    }

    @Test
    void testOtherKinds() {
        assertEquals(new SequenceElement(List.of(), span), coercion.display(Value.NONE, span));
        assertEquals(new TextElement("if", span), coercion.display(new Value("if"), span));
        assertEquals(new TextElement("∞", span), coercion.display(new Value(MathSymbol.of("infinity", "∞")), span));
        assertEquals(new TextElement("units", span), coercion.display(new Value(new MathModule("units", Map.of())), span));
        // 内容值只替换区间
        assertEquals(new TextElement("x", span), coercion.display(new Value(new TextElement("x", Span.of(0, 1))), span));
    }
}
