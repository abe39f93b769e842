package org.csu.mathmode.compiler.semantic;

import lombok.Getter;
import org.csu.mathmode.common.exception.EvalException;
import org.csu.mathmode.common.model.MathModule;
import org.csu.mathmode.common.model.MathSymbol;
import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.Value;

/**
 * @author hidyouth
 * @description: 名称解析器
 * 负责在数学作用域中查找标识符，以及对值做字段投影。纯查找，没有副作用。
 */
public class ScopeResolver {

    @Getter
    private final MathScope scope;

    public ScopeResolver(MathScope scope) {
        this.scope = scope;
    }

    /**
     * @throws EvalException UNRESOLVED_IDENTIFIER，名称不在作用域中
     */
    public Value resolve(String name, Span span) {
        Value value = scope.get(name);
        if (value == null) {
            throw EvalException.unresolvedIdentifier(name, span);
        }
        return value;
    }

    /**
     * 从 target 中取出 field。符号投影其修饰变体，模块投影其成员，其他种类的值没有字段。
     *
     * @throws EvalException NO_SUCH_FIELD
     */
    public Value project(Value target, String field, Span span) {
        switch (target.getKind()) {
            case SYMBOL: {
                MathSymbol variant = target.asSymbol().variant(field);
                if (variant != null) {
                    return new Value(variant);
                }
                break;
            }
            case MODULE: {
                MathModule module = target.asModule();
                Value member = module.member(field);
                if (member != null) {
                    return member;
                }
                break;
            }
            default:
                break;
        }
        throw EvalException.noSuchField(target.getKind(), field, span);
    }
}
