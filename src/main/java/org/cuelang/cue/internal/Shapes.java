package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Attribute;
import org.cuelang.cue.ast.CommentGroup;
import org.cuelang.cue.ast.Decl;
import org.cuelang.cue.ast.Ellipsis;
import org.cuelang.cue.ast.EmbedDecl;
import org.cuelang.cue.ast.Expr;
import org.cuelang.cue.ast.Field;
import org.cuelang.cue.ast.File;
import org.cuelang.cue.ast.ImportDecl;
import org.cuelang.cue.ast.ListLit;
import org.cuelang.cue.ast.Node;
import org.cuelang.cue.ast.Package;
import org.cuelang.cue.ast.StructLit;
import org.cuelang.cue.ast.astutil.AstUtil;
import org.cuelang.cue.token.RelPos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts documents between their three shapes:
 * - File: a whole source file, with package clause and imports
 * - StructLit: the body of a file as a struct literal
 * - Expr: a bare expression
 *
 * {@link #toFile} and {@link #toStruct} move declaration lists between
 * nodes rather than copying them: a struct is surrendered, a file keeps its
 * preamble. {@link #toExpression} leaves the file untouched and puts the
 * body declarations in a list of its own.
 */
public final class Shapes {

    private static final Logger LOGGER = LoggerFactory.getLogger(Shapes.class);

    private Shapes() {
    }

    /**
     * Converts a node to an expression.
     *
     * An expression is returned as is. For a file, the declarations after the
     * package clause and imports are collected into a new list and the file
     * is not modified. A single embedding is returned as its embedded
     * expression, anything else as a struct literal over the new list.
     *
     * @return The expression, or null if {@code node} is null
     * @throws UnsupportedNodeKindException if {@code node} is neither a file
     *                                      nor an expression
     */
    public static Expr toExpression(Node node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Expr expr) {
            return expr;
        }
        if (node instanceof File file) {
            List<Decl> decls = file.decls();
            List<Decl> body = new ArrayList<>(decls.subList(leadingPreambleEnd(decls), decls.size()));
            if (body.size() == 1 && body.get(0) instanceof EmbedDecl embed) {
                return embed.expr();
            }
            return new StructLit(body);
        }
        throw new UnsupportedNodeKindException("toExpression", node);
    }

    /**
     * Converts a node to a file.
     *
     * A struct literal hands its declarations over to the new file and is
     * surrendered. Any other expression is embedded in a new file, with its
     * leading space removed. A file is returned as is.
     *
     * @return The file, or null if {@code node} is null
     * @throws UnsupportedNodeKindException if {@code node} is neither a file
     *                                      nor an expression
     */
    public static File toFile(Node node) {
        if (node == null) {
            return null;
        }
        if (node instanceof StructLit struct) {
            return new File(struct.surrender());
        }
        if (node instanceof Expr expr) {
            expr.setRelPos(RelPos.NO_SPACE);
            List<Decl> decls = new ArrayList<>();
            decls.add(new EmbedDecl(expr));
            return new File(decls);
        }
        if (node instanceof File file) {
            return file;
        }
        throw new UnsupportedNodeKindException("toFile", node);
    }

    /**
     * Moves the non-preamble declarations of a file into a new struct literal.
     *
     * Unlike {@link #toExpression}, every package clause and import counts as
     * preamble, wherever it occurs: the struct receives the declarations after
     * the last of them.
     */
    public static StructLit toStruct(File file) {
        int start = 0;
        List<Decl> decls = file.decls();
        for (int i = 0; i < decls.size(); i++) {
            Decl d = decls.get(i);
            if (d instanceof Package || d instanceof ImportDecl) {
                start = i + 1;
            }
        }
        if (start > 0 && start < decls.size() && start != leadingPreambleEnd(decls)) {
            LOGGER.debug("Package clause or import after body declarations in '{}'", file.filename());
        }
        return new StructLit(file.detach(start));
    }

    /**
     * Wraps a struct literal in an embedding.
     *
     * If the struct has a single element, the position and comments of that
     * element move to the embedding so that the struct prints as if it were
     * not there. The braces are set to print on their own lines.
     */
    public static EmbedDecl collapseToEmbedding(StructLit struct) {
        EmbedDecl e = new EmbedDecl(struct);
        List<Decl> elts = struct.elements();
        if (elts.size() == 1) {
            Decl d = elts.get(0);
            AstUtil.copyPosition(e, d);
            d.setRelPos(RelPos.NO_SPACE);
            AstUtil.copyComments(e, d);
            d.setComments(null);
            if (d instanceof Field field) {
                field.label().setRelPos(RelPos.NO_SPACE);
            }
        }
        struct.setLbrace(RelPos.NEWLINE.pos());
        struct.setRbrace(RelPos.NO_SPACE.pos());
        return e;
    }

    /**
     * Separates a trailing ellipsis from the elements of a list literal.
     */
    public static ListElements splitListEllipsis(ListLit list) {
        List<Expr> elts = list.elements();
        int n = elts.size();
        if (n > 0 && elts.get(n - 1) instanceof Ellipsis ellipsis) {
            return new ListElements(List.copyOf(elts.subList(0, n - 1)), Optional.of(ellipsis));
        }
        return new ListElements(List.copyOf(elts), Optional.empty());
    }

    /**
     * Returns the index after the last package clause or import in the
     * leading run of package clauses, imports, comments and attributes.
     */
    private static int leadingPreambleEnd(List<Decl> decls) {
        int start = 0;
        for (int i = 0; i < decls.size(); i++) {
            Decl d = decls.get(i);
            if (d instanceof Package || d instanceof ImportDecl) {
                start = i + 1;
            } else if (!(d instanceof CommentGroup || d instanceof Attribute)) {
                break;
            }
        }
        return start;
    }
}
