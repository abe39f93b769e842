package org.csu.mathmode.common.model;

import org.csu.mathmode.content.ContentElement;

import java.util.Objects;

/**
 * 表示一个动态类型的值，可以是不同种类。
 */
public class Value {

    public static final Value NONE = new Value(ValueKind.NONE, null);

    private final ValueKind kind;
    private final Object value;

    public Value(Number value) {
        this(ValueKind.NUMBER, value);
    }

    public Value(String value) {
        this(ValueKind.STRING, value);
    }

    public Value(MathSymbol value) {
        this(ValueKind.SYMBOL, value);
    }

    public Value(ContentElement value) {
        this(ValueKind.CONTENT, value);
    }

    public Value(MathFunction value) {
        this(ValueKind.FUNCTION, value);
    }

    public Value(MathModule value) {
        this(ValueKind.MODULE, value);
    }

    private Value(ValueKind kind, Object value) {
        if (kind != ValueKind.NONE) {
            Objects.requireNonNull(value, "value");
        }
        this.kind = kind;
        this.value = value;
    }

    public ValueKind getKind() {
        return kind;
    }

    public Number asNumber() {
        return (Number) expect(ValueKind.NUMBER);
    }

    public String asString() {
        return (String) expect(ValueKind.STRING);
    }

    public MathSymbol asSymbol() {
        return (MathSymbol) expect(ValueKind.SYMBOL);
    }

    public ContentElement asContent() {
        return (ContentElement) expect(ValueKind.CONTENT);
    }

    public MathFunction asFunction() {
        return (MathFunction) expect(ValueKind.FUNCTION);
    }

    public MathModule asModule() {
        return (MathModule) expect(ValueKind.MODULE);
    }

    private Object expect(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected a " + expected + " value, but found " + kind);
        }
        return value;
    }

    @Override
    public String toString() {
        return kind == ValueKind.NONE ? "none" : kind + "(" + value + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value value1 = (Value) o;
        return kind == value1.kind && Objects.equals(value, value1.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }
}
