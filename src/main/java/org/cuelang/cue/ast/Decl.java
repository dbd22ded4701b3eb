package org.cuelang.cue.ast;

/**
 * A declaration: a unit that can appear in the body of a file or a struct.
 */
public sealed interface Decl extends Node
        permits Package, ImportDecl, CommentGroup, Attribute, Field, EmbedDecl, Ellipsis, StructLit {
}
