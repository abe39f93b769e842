package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 根式，index 可以为 null (平方根)。
 */
public record RootElement(ContentElement radicand, ContentElement index, Span span) implements ContentElement {

    @Override
    public RootElement withSpan(Span span) {
        return new RootElement(radicand, index, span);
    }

    @Override
    public String plainText() {
        return index == null
                ? "root(" + radicand.plainText() + ")"
                : "root(" + index.plainText() + ", " + radicand.plainText() + ")";
    }
}
