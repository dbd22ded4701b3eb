package org.cuelang.cue.ast.astutil;

import org.cuelang.cue.ast.Node;

/**
 * Copies position and comment metadata between nodes, for rewrites that
 * replace one node with another while keeping its place in the formatted
 * output.
 */
public final class AstUtil {

    private AstUtil() {
    }

    /**
     * Copies the position and the comments of {@code from} to {@code to}.
     *
     * @return {@code to}
     */
    public static <T extends Node> T copyMeta(T to, Node from) {
        if (from == null) {
            return to;
        }
        copyPosition(to, from);
        copyComments(to, from);
        return to;
    }

    /**
     * Copies the position, including its relative class, of {@code from} to
     * {@code to}.
     */
    public static void copyPosition(Node to, Node from) {
        if (from == null) {
            return;
        }
        to.setPos(from.pos());
    }

    /**
     * Replaces the comments of {@code to} with those of {@code from}. The
     * comment groups themselves are shared, not copied.
     */
    public static void copyComments(Node to, Node from) {
        if (from == null) {
            return;
        }
        to.setComments(from.comments());
    }
}
