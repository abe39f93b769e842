package org.csu.mathmode.compiler.parser.ast;

import org.csu.mathmode.common.model.Span;

/**
 * 定界符：源码中的字面写法与规范化后的字形，例如 "[|" 与 "⟦"。
 */
public record Delimiter(String literal, String canonical, Span span) {
}
