package org.csu.mathmode.common.exception;

import org.csu.mathmode.common.model.Span;
import org.csu.mathmode.common.model.ValueKind;

/**
 * @author hidyouth
 * @description: 名称解析与内容构建阶段的异常
 */
public class EvalException extends MathException {

    public enum Kind {
        UNRESOLVED_IDENTIFIER,
        NO_SUCH_FIELD,
        NOT_CALLABLE,
        INVALID_ARGUMENTS
    }

    private final Kind kind;
    private final String name;
    private final ValueKind valueKind; // 仅 NO_SUCH_FIELD / NOT_CALLABLE 时有值

    private EvalException(Kind kind, String message, Span span, String name, ValueKind valueKind) {
        super(message, span);
        this.kind = kind;
        this.name = name;
        this.valueKind = valueKind;
    }

    public static EvalException unresolvedIdentifier(String name, Span span) {
        return new EvalException(Kind.UNRESOLVED_IDENTIFIER,
                "Unknown variable '" + name + "' at " + span, span, name, null);
    }

    public static EvalException noSuchField(ValueKind valueKind, String field, Span span) {
        return new EvalException(Kind.NO_SUCH_FIELD,
                "Value of kind " + valueKind + " has no field '" + field + "' at " + span, span, field, valueKind);
    }

    public static EvalException notCallable(ValueKind valueKind, String callee, Span span) {
        return new EvalException(Kind.NOT_CALLABLE,
                "Value of kind " + valueKind + " ('" + callee + "') is not callable at " + span, span, callee, valueKind);
    }

    public static EvalException invalidArguments(String function, String reason, Span span) {
        return new EvalException(Kind.INVALID_ARGUMENTS,
                "Invalid arguments for '" + function + "': " + reason + " at " + span, span, function, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * 相关的标识符、字段名或函数名。
     */
    public String name() {
        return name;
    }

    public ValueKind valueKind() {
        return valueKind;
    }

    @Override
    public String kindName() {
        return kind.name();
    }
}
