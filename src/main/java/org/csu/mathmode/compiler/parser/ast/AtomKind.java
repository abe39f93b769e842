package org.csu.mathmode.compiler.parser.ast;

/**
 * 原子的种类。
 */
public enum AtomKind {
    IDENT,   // 标识符，多字符时需要在作用域中解析
    NUMBER,
    SYMBOL,  // 运算符、标点、规范化后的简写
    TEXT     // 引号文本或转义字符，原样输出
}
