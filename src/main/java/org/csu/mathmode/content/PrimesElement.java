package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 撇号 (prime) 计数，排版时与普通上标不同。
 */
public record PrimesElement(int count, Span span) implements ContentElement {

    @Override
    public PrimesElement withSpan(Span span) {
        return new PrimesElement(count, span);
    }

    @Override
    public String plainText() {
        return "'".repeat(count);
    }
}
