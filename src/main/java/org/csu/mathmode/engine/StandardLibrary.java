package org.csu.mathmode.engine;

import org.csu.mathmode.common.exception.EvalException;
import org.csu.mathmode.common.model.MathFunction;
import org.csu.mathmode.common.model.MathSymbol;
import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.Value;
import org.csu.mathmode.compiler.parser.SymbolNames;
import org.csu.mathmode.compiler.semantic.MathScope;
import org.csu.mathmode.content.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * 默认的数学作用域：具名符号、带修饰变体的符号、运算符函数和排版函数。
 *
 * 作用域只构建一次并共享，因为其中的函数值按引用比较。
 */
public final class StandardLibrary {

    private static final List<String> OPERATORS = List.of(
            "sin", "cos", "tan", "log", "ln", "exp", "lim", "max", "min", "det"
    );

    private static final MathScope SCOPE = build();

    private StandardLibrary() {
    }

    public static MathScope scope() {
        return SCOPE;
    }

    private static MathScope build() {
        MathScope.Builder builder = MathScope.builder();
        SymbolNames.glyphs().forEach((name, glyph) -> builder.define(name, new Value(MathSymbol.of(name, glyph))));

        builder.define("arrow", new Value(new MathSymbol("arrow", "→", Map.of(
                "r", arrow("arrow.r", "→", "⇒"),
                "l", arrow("arrow.l", "←", "⇐"),
                "t", arrow("arrow.t", "↑", "⇑"),
                "b", arrow("arrow.b", "↓", "⇓")
        ))));
        builder.define("dots", new Value(new MathSymbol("dots", "…", Map.of(
                "h", MathSymbol.of("dots.h", "…"),
                "v", MathSymbol.of("dots.v", "⋮"),
                "c", MathSymbol.of("dots.c", "⋯"),
                "down", MathSymbol.of("dots.down", "⋱")
        ))));

        for (String name : OPERATORS) {
            builder.define(name, new Value(new Builtin(name, -1, (args, span) -> operator(name, args, span))));
        }

        builder.define("sqrt", function("sqrt", 1, (args, span) -> new RootElement(args.get(0), null, span)));
        builder.define("root", function("root", 2, (args, span) -> new RootElement(args.get(1), args.get(0), span)));
        builder.define("frac", function("frac", 2, (args, span) -> new FracElement(args.get(0), args.get(1), span)));
        builder.define("abs", delimited("abs", "|", "|"));
        builder.define("norm", delimited("norm", "‖", "‖"));
        builder.define("floor", delimited("floor", "⌊", "⌋"));
        builder.define("ceil", delimited("ceil", "⌈", "⌉"));
        return builder.build();
    }

    private static MathSymbol arrow(String name, String glyph, String doubleGlyph) {
        return new MathSymbol(name, glyph, Map.of("double", MathSymbol.of(name + ".double", doubleGlyph)));
    }

    private static Value function(String name, int arity, BiFunction<List<ContentElement>, Span, ContentElement> body) {
        return new Value(new Builtin(name, arity, body));
    }

    private static Value delimited(String name, String open, String close) {
        return function(name, 1, (args, span) -> new DelimitedElement(open, args.get(0), close, span));
    }

    /**
     * 运算符函数显示为正体名称加括号参数，例如 sin(x)。
     */
    private static ContentElement operator(String name, List<ContentElement> args, Span span) {
        List<ContentElement> body = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                body.add(new TextElement(",", span));
            }
            body.add(args.get(i));
        }
        return new SequenceElement(List.of(
                new TextElement(name, span),
                new DelimitedElement("(", new SequenceElement(body, span), ")", span)
        ), span);
    }

    /**
     * 内置函数。arity 为 -1 表示参数个数不限。
     */
    private record Builtin(String name, int arity,
                           BiFunction<List<ContentElement>, Span, ContentElement> body) implements MathFunction {

        @Override
        public Value call(List<ContentElement> args, Span span) {
            if (arity >= 0 && args.size() != arity) {
                throw EvalException.invalidArguments(name,
                        "expected " + arity + " argument(s) but got " + args.size(), span);
            }
            return new Value(body.apply(args, span));
        }

        @Override
        public String toString() {
            return "function(" + name + ")";
        }
    }
}
