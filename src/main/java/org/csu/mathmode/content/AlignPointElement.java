package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 多行公式的对齐点。
 */
public record AlignPointElement(Span span) implements ContentElement {

    @Override
    public AlignPointElement withSpan(Span span) {
        return new AlignPointElement(span);
    }

    @Override
    public String plainText() {
        return "&";
    }
}
