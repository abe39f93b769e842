package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

/**
 * 上下标附着。top 为显式上标；topRight 只在没有显式上标时放置撇号；bottom 为下标。
 * 三个槽位都可以为 null。
 */
public record AttachElement(
        ContentElement base,
        ContentElement top,
        PrimesElement topRight,
        ContentElement bottom,
        Span span
) implements ContentElement {

    @Override
    public AttachElement withSpan(Span span) {
        return new AttachElement(base, top, topRight, bottom, span);
    }

    @Override
    public String plainText() {
        StringBuilder sb = new StringBuilder("attach(").append(base.plainText());
        if (top != null) {
            sb.append(", t: ").append(top.plainText());
        }
        if (topRight != null) {
            sb.append(", tr: ").append(topRight.plainText());
        }
        if (bottom != null) {
            sb.append(", b: ").append(bottom.plainText());
        }
        return sb.append(')').toString();
    }
}
