package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 一段文本 (字母、数字、符号或空白)。
 */
public record TextElement(String text, Span span) implements ContentElement {

    @Override
    public TextElement withSpan(Span span) {
        return new TextElement(text, span);
    }

    @Override
    public String plainText() {
        return text;
    }
}
