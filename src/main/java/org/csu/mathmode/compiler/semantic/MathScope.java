package org.csu.mathmode.compiler.semantic;

import lombok.Getter;
import org.csu.mathmode.common.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 数学模式专用的名称作用域，与文档的普通作用域分开。
 *
 * 构建完成后不可变；求值期间只查找、不修改。可以叠加在一个父作用域 (例如文档作用域) 之上，
 * 查找时先查自身绑定，再查父作用域。
 */
public final class MathScope {

    private static final MathScope EMPTY = new MathScope(Map.of(), null);

    private final Map<String, Value> bindings;
    @Getter
    private final MathScope parent; // 可以为 null

    private MathScope(Map<String, Value> bindings, MathScope parent) {
        this.bindings = bindings;
        this.parent = parent;
    }

    public static MathScope empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return 绑定的值，不存在时返回 null
     */
    public Value get(String name) {
        Value value = bindings.get(name);
        if (value == null && parent != null) {
            return parent.get(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * 仅本层的名称，不含父作用域。
     */
    public Set<String> names() {
        return bindings.keySet();
    }

    /**
     * 返回一个以当前作用域为父、追加了 overrides 绑定的新作用域。
     */
    public MathScope extend(Map<String, Value> overrides) {
        return new MathScope(Collections.unmodifiableMap(new LinkedHashMap<>(overrides)), this);
    }

    public static final class Builder {
        private final Map<String, Value> bindings = new LinkedHashMap<>();
        private MathScope parent;

        private Builder() {
        }

        public Builder define(String name, Value value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Binding name must not be empty");
            }
            bindings.put(name, value);
            return this;
        }

        public Builder parent(MathScope parent) {
            this.parent = parent;
            return this;
        }

        public MathScope build() {
            return new MathScope(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)), parent);
        }
    }
}
