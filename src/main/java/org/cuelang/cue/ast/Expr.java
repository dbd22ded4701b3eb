package org.cuelang.cue.ast;

/**
 * An expression.
 */
public sealed interface Expr extends Node
        permits Ident, BasicLit, BottomLit, StructLit, ListLit, Ellipsis,
        UnaryExpr, BinaryExpr, ParenExpr, SelectorExpr, CallExpr {
}
