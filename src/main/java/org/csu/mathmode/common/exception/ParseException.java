package org.csu.mathmode.common.exception;

import org.csu.mathmode.common.model.Span;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常
 */
public class ParseException extends MathException {

    public enum Kind {
        UNBALANCED_DELIMITER,
        DANGLING_OPERATOR,
        AMBIGUOUS_ATTACHMENT,
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final String glyph;

    public ParseException(Kind kind, Span span, String glyph) {
        super(String.format("%s at %s: '%s'", kind, span, glyph), span);
        this.kind = kind;
        this.glyph = glyph;
    }

    public static ParseException unbalancedDelimiter(String glyph, Span span) {
        return new ParseException(Kind.UNBALANCED_DELIMITER, span, glyph);
    }

    public static ParseException danglingOperator(String glyph, Span span) {
        return new ParseException(Kind.DANGLING_OPERATOR, span, glyph);
    }

    public static ParseException ambiguousAttachment(String glyph, Span span) {
        return new ParseException(Kind.AMBIGUOUS_ATTACHMENT, span, glyph);
    }

    public static ParseException nestingTooDeep(String glyph, Span span) {
        return new ParseException(Kind.NESTING_TOO_DEEP, span, glyph);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * 出错位置的字形，例如未匹配的 '(' 或悬空的 '/'。
     */
    public String glyph() {
        return glyph;
    }

    @Override
    public String kindName() {
        return kind.name();
    }
}
