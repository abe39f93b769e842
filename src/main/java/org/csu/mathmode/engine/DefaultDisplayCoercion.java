package org.csu.mathmode.engine;

import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.Value;
import org.csu.mathmode.content.ContentElement;
import org.csu.mathmode.content.SequenceElement;
import org.csu.mathmode.content.TextElement;

import java.math.BigDecimal;
import java.util.List;

/**
 * 默认的显示转换，在没有外部求值器时使用。
 */
public class DefaultDisplayCoercion implements DisplayCoercion {

    @Override
    public ContentElement display(Value value, Span span) {
        return switch (value.getKind()) {
            case NONE -> new SequenceElement(List.of(), span);
            case NUMBER -> new TextElement(formatNumber(value.asNumber()), span);
            case STRING -> new TextElement(value.asString(), span);
            case SYMBOL -> new TextElement(value.asSymbol().glyph(), span);
            case CONTENT -> value.asContent().withSpan(span);
            case FUNCTION -> new TextElement(value.asFunction().name(), span);
            case MODULE -> new TextElement(value.asModule().name(), span);
        };
    }

    private static String formatNumber(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        return number.toString();
    }
}
