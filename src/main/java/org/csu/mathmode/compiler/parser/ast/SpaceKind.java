package org.csu.mathmode.compiler.parser.ast;

public enum SpaceKind {
    TIGHT,
    WIDE
}
