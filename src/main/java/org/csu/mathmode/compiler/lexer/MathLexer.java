package org.csu.mathmode.compiler.lexer;

import org.csu.mathmode.common.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 数学模式的参考词法分析器
 *
 * 负责将数学源码分解为 SyntaxConstituent 序列。每个字符都会落入某个节点，
 * 因此不存在失败情况。
 */
public class MathLexer {

    // 按长度从长到短排列，保证最长匹配
    private static final List<String> SHORTHANDS = List.of(
            "...", "[|", "|]", "||", "->", "<-", "=>", "<=", ">=", "!=", "<<", ">>", ":="
    );

    private final String input;
    private int position = 0; // 当前读取的位置

    public MathLexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有节点
     * @return 节点列表
     */
    public List<SyntaxConstituent> tokenize() {
        List<SyntaxConstituent> constituents = new ArrayList<>();
        while (position < input.length()) {
            constituents.add(nextConstituent());
        }
        return constituents;
    }

    private SyntaxConstituent nextConstituent() {
        char currentChar = peek();

        if (Character.isWhitespace(currentChar)) {
            return readSpace();
        }
        if (Character.isLetter(currentChar)) {
            return readIdentifier();
        }
        if (isDigit(currentChar)) {
            return readNumber();
        }
        if (currentChar == '"') {
            return readString();
        }
        if (currentChar == '\\' && position + 1 < input.length()) {
            int start = position;
            advance(); // 跳过反斜杠
            advance();
            return SyntaxConstituent.leaf(SyntaxKind.ESCAPE, input.substring(start + 1, position), Span.of(start, position));
        }
        for (String shorthand : SHORTHANDS) {
            if (input.startsWith(shorthand, position)) {
                int start = position;
                position += shorthand.length();
                return SyntaxConstituent.leaf(SyntaxKind.SHORTHAND, shorthand, Span.of(start, position));
            }
        }
        int start = position;
        advance();
        return SyntaxConstituent.leaf(SyntaxKind.TEXT, String.valueOf(currentChar), Span.of(start, position));
    }

    private SyntaxConstituent readSpace() {
        int startPos = position;
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
        return SyntaxConstituent.leaf(SyntaxKind.SPACE, input.substring(startPos, position), Span.of(startPos, position));
    }

    private SyntaxConstituent readIdentifier() {
        int startPos = position;
        while (position < input.length() && Character.isLetter(peek())) {
            advance();
        }
        return SyntaxConstituent.leaf(SyntaxKind.IDENT, input.substring(startPos, position), Span.of(startPos, position));
    }

    private SyntaxConstituent readNumber() {
        int startPos = position;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        // 小数点后必须还有数字，以区分 x.field 语法和句末的点
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        return SyntaxConstituent.leaf(SyntaxKind.NUMBER, input.substring(startPos, position), Span.of(startPos, position));
    }

    private SyntaxConstituent readString() {
        int startPos = position;
        advance(); // 跳过起始的引号
        int textStart = position;
        while (position < input.length() && peek() != '"') {
            advance();
        }
        String text = input.substring(textStart, position);
        if (position < input.length()) {
            advance(); // 跳过结束的引号; 未闭合时吞掉剩余输入
        }
        return SyntaxConstituent.leaf(SyntaxKind.STRING, text, Span.of(startPos, position));
    }

    // --- 辅助方法 ---

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
