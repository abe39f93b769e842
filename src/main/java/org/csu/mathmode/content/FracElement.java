package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 分式。
 */
public record FracElement(ContentElement num, ContentElement denom, Span span) implements ContentElement {

    @Override
    public FracElement withSpan(Span span) {
        return new FracElement(num, denom, span);
    }

    @Override
    public String plainText() {
        return "frac(" + num.plainText() + ", " + denom.plainText() + ")";
    }
}
