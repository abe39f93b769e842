package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 定界组，open/close 为规范化后的字形，由排版阶段自动调整大小。
 */
public record DelimitedElement(String open, ContentElement body, String close, Span span) implements ContentElement {

    @Override
    public DelimitedElement withSpan(Span span) {
        return new DelimitedElement(open, body, close, span);
    }

    @Override
    public String plainText() {
        return open + body.plainText() + close;
    }
}
