package org.cuelang.cue.ast;

/**
 * A field label.
 *
 * - Ident: a plain name, {@code foo} or {@code #Foo}
 * - Alias: a name bound to an alias, {@code X=foo}
 * - ListLit: a pattern matching a set of names, {@code [string]}
 * - BasicLit: a quoted name, {@code "foo-bar"}
 * - ParenExpr: a computed name, {@code (expr)}
 */
public sealed interface Label extends Node
        permits Ident, Alias, ListLit, BasicLit, ParenExpr {
}
