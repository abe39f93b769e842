package org.csu.mathmode.common.exception;

import org.csu.mathmode.common.model.Span;

/**
 * 数学模式处理过程中所有错误的公共父类。
 * 每个错误都携带出错构造的精确源码区间，供调用方的诊断格式化器使用。
 */
public abstract class MathException extends RuntimeException {

    private final Span span;

    protected MathException(String message, Span span) {
        super(message);
        this.span = span;
    }

    public Span span() {
        return span;
    }

    /**
     * 错误种类的名称，例如 "UNBALANCED_DELIMITER"。
     */
    public abstract String kindName();
}
