package org.csu.mathmode.common.model;

import java.util.Map;

/**
 * 一个数学符号：默认字形加上按修饰名索引的变体，例如 arrow -> arrow.r -> arrow.r.double。
 *
 * @param name     符号名
 * @param glyph    默认显示的字形
 * @param variants 修饰名到变体的映射 (不可变)
 */
public record MathSymbol(String name, String glyph, Map<String, MathSymbol> variants) {

    public MathSymbol {
        variants = Map.copyOf(variants);
    }

    public static MathSymbol of(String name, String glyph) {
        return new MathSymbol(name, glyph, Map.of());
    }

    public MathSymbol variant(String modifier) {
        return variants.get(modifier);
    }
}
