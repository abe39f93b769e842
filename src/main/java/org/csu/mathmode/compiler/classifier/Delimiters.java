package org.csu.mathmode.compiler.classifier;

import java.util.Map;
import java.util.Set;

/**
 * 定界符配对表与简写规范化表。
 */
public final class Delimiters {

    private static final Map<String, String> PAIRS = Map.of(
            "(", ")",
            "[", "]",
            "{", "}",
            "⟨", "⟩",
            "⟦", "⟧",
            "⌊", "⌋",
            "⌈", "⌉"
    );

    private static final Set<String> CLOSERS = Set.copyOf(PAIRS.values());

    private static final Set<String> FENCES = Set.of("|", "‖");

    private static final Map<String, String> SHORTHANDS = Map.ofEntries(
            Map.entry("[|", "⟦"),
            Map.entry("|]", "⟧"),
            Map.entry("||", "‖"),
            Map.entry("->", "→"),
            Map.entry("<-", "←"),
            Map.entry("=>", "⇒"),
            Map.entry("<=", "≤"),
            Map.entry(">=", "≥"),
            Map.entry("!=", "≠"),
            Map.entry("...", "…"),
            Map.entry("<<", "≪"),
            Map.entry(">>", "≫"),
            Map.entry(":=", "≔")
    );

    private Delimiters() {
    }

    public static boolean isOpening(String glyph) {
        return PAIRS.containsKey(glyph);
    }

    public static boolean isClosing(String glyph) {
        return CLOSERS.contains(glyph);
    }

    public static boolean isFence(String glyph) {
        return FENCES.contains(glyph);
    }

    /**
     * 给定开定界符，返回与之匹配的闭定界符；围栏与自身匹配。
     */
    public static String closerFor(String opening) {
        if (FENCES.contains(opening)) {
            return opening;
        }
        String closer = PAIRS.get(opening);
        if (closer == null) {
            throw new IllegalArgumentException("Not an opening delimiter: " + opening);
        }
        return closer;
    }

    /**
     * 简写的规范形式；未知简写原样返回。
     */
    public static String canonicalShorthand(String shorthand) {
        return SHORTHANDS.getOrDefault(shorthand, shorthand);
    }
}
