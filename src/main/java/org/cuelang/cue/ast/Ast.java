package org.cuelang.cue.ast;

import org.cuelang.cue.token.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory helpers for building syntax trees in code, for trees that do not
 * come from the parser.
 */
public final class Ast {

    private Ast() {
    }

    public static Ident newIdent(String name) {
        return new Ident(name);
    }

    /**
     * Creates a double-quoted string literal for the given unquoted value.
     */
    public static BasicLit newString(String value) {
        return new BasicLit(Token.STRING, quote(value));
    }

    public static BasicLit newInt(long value) {
        return new BasicLit(Token.INT, Long.toString(value));
    }

    public static BasicLit newBool(boolean value) {
        return value ? new BasicLit(Token.TRUE, "true") : new BasicLit(Token.FALSE, "false");
    }

    public static BasicLit newNull() {
        return new BasicLit(Token.NULL, "null");
    }

    /**
     * Creates a regular field with an identifier label.
     */
    public static Field newField(String label, Expr value) {
        return new Field(new Ident(label), value);
    }

    /**
     * Creates a struct owning a fresh list of the given declarations.
     */
    public static StructLit newStruct(Decl... decls) {
        return new StructLit(new ArrayList<>(Arrays.asList(decls)));
    }

    public static ListLit newList(Expr... elts) {
        return new ListLit(Arrays.asList(elts));
    }

    public static BinaryExpr newBinExpr(Token op, Expr x, Expr y) {
        return new BinaryExpr(x, op, y);
    }

    public static EmbedDecl embed(Expr expr) {
        return new EmbedDecl(expr);
    }

    public static ImportDecl newImport(String path) {
        return new ImportDecl(List.of(new ImportSpec(null, newString(path))));
    }

    /**
     * Creates a comment group from lines that already carry their marker.
     */
    public static CommentGroup newCommentGroup(boolean doc, String... lines) {
        List<Comment> list = new ArrayList<>();
        for (String line : lines) {
            list.add(new Comment(line));
        }
        CommentGroup cg = new CommentGroup(list);
        cg.setDoc(doc);
        return cg;
    }

    /**
     * Creates a file owning a fresh list of the given declarations.
     */
    public static File newFile(Decl... decls) {
        return new File(new ArrayList<>(Arrays.asList(decls)));
    }

    private static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
