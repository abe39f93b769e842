package org.csu.mathmode.content;

import org.csu.mathmode.common.model.Span;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按顺序拼接的内容序列。
 */
public record SequenceElement(List<ContentElement> children, Span span) implements ContentElement {

    public SequenceElement {
        children = List.copyOf(children);
    }

    @Override
    public SequenceElement withSpan(Span span) {
        return new SequenceElement(children, span);
    }

    @Override
    public String plainText() {
        return children.stream().map(ContentElement::plainText).collect(Collectors.joining());
    }
}
