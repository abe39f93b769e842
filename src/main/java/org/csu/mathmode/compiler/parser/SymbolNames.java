package org.csu.mathmode.compiler.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 具名字形符号表，例如 pi -> π。
 *
 * 这些名字虽然是多字符标识符，但代表单个字形，因此紧跟括号时按并列而不是函数调用处理：
 * pi(x) 是 "π 乘以 (x)"。
 */
public final class SymbolNames {

    private static final Map<String, String> GLYPHS = new LinkedHashMap<>();

    // 带修饰变体的符号 (arrow.r, dots.h)，同样不可调用
    private static final Set<String> VARIANT_SYMBOLS = Set.of("arrow", "dots");

    static {
        String[][] greek = {
                {"alpha", "α"}, {"beta", "β"}, {"gamma", "γ"}, {"delta", "δ"}, {"epsilon", "ε"},
                {"zeta", "ζ"}, {"eta", "η"}, {"theta", "θ"}, {"iota", "ι"}, {"kappa", "κ"},
                {"lambda", "λ"}, {"mu", "μ"}, {"nu", "ν"}, {"xi", "ξ"}, {"omicron", "ο"},
                {"pi", "π"}, {"rho", "ρ"}, {"sigma", "σ"}, {"tau", "τ"}, {"upsilon", "υ"},
                {"phi", "φ"}, {"chi", "χ"}, {"psi", "ψ"}, {"omega", "ω"},
                {"Gamma", "Γ"}, {"Delta", "Δ"}, {"Theta", "Θ"}, {"Lambda", "Λ"}, {"Xi", "Ξ"},
                {"Pi", "Π"}, {"Sigma", "Σ"}, {"Phi", "Φ"}, {"Psi", "Ψ"}, {"Omega", "Ω"}
        };
        for (String[] entry : greek) {
            GLYPHS.put(entry[0], entry[1]);
        }
        GLYPHS.put("infinity", "∞");
        GLYPHS.put("oo", "∞");
        GLYPHS.put("sum", "∑");
        GLYPHS.put("product", "∏");
        GLYPHS.put("integral", "∫");
        GLYPHS.put("partial", "∂");
        GLYPHS.put("nabla", "∇");
        GLYPHS.put("emptyset", "∅");
        GLYPHS.put("times", "×");
        GLYPHS.put("dot", "⋅");
    }

    private SymbolNames() {
    }

    public static boolean isSymbolName(String name) {
        return GLYPHS.containsKey(name) || VARIANT_SYMBOLS.contains(name);
    }

    /**
     * 名称到字形的只读视图，按定义顺序。
     */
    public static Map<String, String> glyphs() {
        return Collections.unmodifiableMap(GLYPHS);
    }
}
