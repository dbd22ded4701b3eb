package org.cuelang.cue.ast;

import org.cuelang.cue.token.Pos;
import org.cuelang.cue.token.RelPos;

import java.util.List;

/**
 * Sealed interface for every node of a CUE syntax tree.
 *
 * Type hierarchy:
 * Node
 * ├── File (a whole source file)
 * ├── Decl (declarations inside a file or struct)
 * ├── Expr (expressions)
 * ├── Label (field labels)
 * ├── ImportSpec
 * └── Comment (a single comment line)
 *
 * Several concrete nodes belong to more than one category: an {@link Ident}
 * is both an expression and a label, a {@link StructLit} is both an
 * expression and a declaration.
 *
 * Nodes are mutable. Positions and attached comments are rewritten in place
 * by the normalization utilities in {@code org.cuelang.cue.internal}.
 */
public sealed interface Node permits File, Decl, Expr, Label, ImportSpec, Comment {

    /**
     * @return The position of the first token of this node
     */
    Pos pos();

    void setPos(Pos pos);

    /**
     * Replaces the relative position class of the first token of this node,
     * keeping its location.
     */
    default void setRelPos(RelPos rel) {
        setPos(pos().withRelPos(rel));
    }

    /**
     * @return Comment groups attached to this node, in attachment order
     */
    List<CommentGroup> comments();

    void addComment(CommentGroup comment);

    /**
     * Replaces all comment groups attached to this node. A null or empty list
     * removes them.
     */
    void setComments(List<CommentGroup> comments);
}
