package org.csu.mathmode.compiler.classifier;

import org.csu.mathmode.compiler.lexer.SyntaxConstituent;
import org.csu.mathmode.compiler.parser.ast.AtomKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 节点分类器。
 *
 * 为一个数学模式区间的有序子节点逐个打上分类标签。纯函数，不会失败：
 * 无法识别的节点一律视为不透明原子。
 */
public class ConstituentClassifier {

    public List<ClassifiedConstituent> classify(List<SyntaxConstituent> constituents) {
        List<ClassifiedConstituent> result = new ArrayList<>(constituents.size());
        for (SyntaxConstituent constituent : constituents) {
            result.add(classify(constituent));
        }
        return result;
    }

    public ClassifiedConstituent classify(SyntaxConstituent constituent) {
        String text = constituent.text();
        switch (constituent.kind()) {
            case IDENT:
                return atom(constituent, text, AtomKind.IDENT);
            case NUMBER:
                return atom(constituent, text, AtomKind.NUMBER);
            case ESCAPE:
            case STRING:
                return atom(constituent, text, AtomKind.TEXT);
            case SPACE:
                return new ClassifiedConstituent(constituent, ConstituentClass.SPACE, text, null);
            case GROUP:
                return new ClassifiedConstituent(constituent, ConstituentClass.GROUP, text, null);
            case SHORTHAND:
                return classifyGlyph(constituent, Delimiters.canonicalShorthand(text));
            case TEXT:
                return classifyGlyph(constituent, text);
            default:
                return atom(constituent, text, AtomKind.SYMBOL);
        }
    }

    private ClassifiedConstituent classifyGlyph(SyntaxConstituent constituent, String glyph) {
        ConstituentClass tag;
        if (Delimiters.isOpening(glyph)) {
            tag = ConstituentClass.OPENING;
        } else if (Delimiters.isClosing(glyph)) {
            tag = ConstituentClass.CLOSING;
        } else if (Delimiters.isFence(glyph)) {
            tag = ConstituentClass.FENCE;
        } else {
            tag = switch (glyph) {
                case "_" -> ConstituentClass.ATTACH_SUB;
                case "^" -> ConstituentClass.ATTACH_SUP;
                case "/" -> ConstituentClass.FRACTION;
                case "'", "′" -> ConstituentClass.PRIME;
                case "!" -> ConstituentClass.FACTORIAL;
                case "√", "∛", "∜" -> ConstituentClass.ROOT;
                case "&" -> ConstituentClass.ALIGN_POINT;
                default -> ConstituentClass.ATOM;
            };
        }
        return new ClassifiedConstituent(constituent, tag, glyph, tag == ConstituentClass.ATOM ? AtomKind.SYMBOL : null);
    }

    private ClassifiedConstituent atom(SyntaxConstituent constituent, String text, AtomKind kind) {
        return new ClassifiedConstituent(constituent, ConstituentClass.ATOM, text, kind);
    }
}
