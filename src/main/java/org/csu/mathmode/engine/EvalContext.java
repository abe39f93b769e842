package org.csu.mathmode.engine;

import lombok.Getter;
import org.csu.mathmode.compiler.semantic.MathScope;
import org.csu.mathmode.compiler.semantic.ScopeResolver;

/**
 * 内容构建所需的外部协作者：数学作用域 (只读) 与显示转换。
 */
@Getter
public class EvalContext {

    private final ScopeResolver resolver;
    private final DisplayCoercion coercion;

    public EvalContext(MathScope scope, DisplayCoercion coercion) {
        this.resolver = new ScopeResolver(scope);
        this.coercion = coercion;
    }
}
