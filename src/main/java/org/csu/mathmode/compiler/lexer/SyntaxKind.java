package org.csu.mathmode.compiler.lexer;

/**
 * @author hidyouth
 * @description: 上游语法节点的种类
 */
public enum SyntaxKind {
    IDENT,      // 字母序列, e.g. x, pi, sin
    NUMBER,     // 123, 1.5
    TEXT,       // 单个字形: + - _ ^ / ' ! & ( ) √ ...
    SHORTHAND,  // 多字符简写: ->, [|, ||, <= ...
    ESCAPE,     // 反斜杠转义, e.g. \_
    STRING,     // 引号中的文本, e.g. "if"
    SPACE,      // 空白
    GROUP       // 上游已组合好的子表达式，子节点在 children 中
}
