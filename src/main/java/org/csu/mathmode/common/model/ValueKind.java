package org.csu.mathmode.common.model;

/**
 * 值的动态类型。
 */
public enum ValueKind {
    NONE,
    NUMBER,
    STRING,
    SYMBOL,
    CONTENT,
    FUNCTION,
    MODULE
}
