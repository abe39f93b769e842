package org.csu.mathmode.compiler.classifier;

import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.compiler.lexer.SyntaxConstituent;
import org.csu.mathmode.compiler.parser.ast.AtomKind;

/**
 * 带分类标签的节点。
 *
 * @param source    原始上游节点
 * @param tag       分类
 * @param canonical 规范化后的字形 (简写与定界符已替换为标准形式)
 * @param atomKind  仅 ATOM 时非空
 */
public record ClassifiedConstituent(
        SyntaxConstituent source,
        ConstituentClass tag,
        String canonical,
        AtomKind atomKind
) {

    public Span span() {
        return source.span();
    }

    public String literal() {
        return source.text();
    }

    public boolean is(ConstituentClass expected) {
        return tag == expected;
    }

    public boolean isSymbol(String glyph) {
        return tag == ConstituentClass.ATOM && atomKind == AtomKind.SYMBOL && canonical.equals(glyph);
    }

    @Override
    public String toString() {
        return String.format("%s['%s' @%s]", tag, canonical, span());
    }
}
