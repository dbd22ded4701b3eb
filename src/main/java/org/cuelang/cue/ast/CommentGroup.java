package org.cuelang.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of comment lines with no other tokens and no empty lines between
 * them.
 *
 * A group is either attached to a node (see {@link Node#comments()}) or
 * stands on its own as a declaration.
 *
 * The attachment {@link #position()} is the slot of the owning node at which
 * the group is printed: {@link #BEFORE_NODE} places it above the node,
 * {@link #AFTER_NODE} on the same line after it.
 */
public final class CommentGroup extends AbstractNode implements Decl {

    public static final int BEFORE_NODE = 0;
    public static final int AFTER_NODE = 10;

    private boolean doc;
    private boolean line;
    private int position;
    private final List<Comment> list;

    public CommentGroup(List<Comment> list) {
        this.list = list == null ? new ArrayList<>() : new ArrayList<>(list);
    }

    /**
     * @return true if this group documents the node that follows it
     */
    public boolean isDoc() {
        return doc;
    }

    public void setDoc(boolean doc) {
        this.doc = doc;
    }

    /**
     * @return true if this group is a trailing comment on the line of its node
     */
    public boolean isLine() {
        return line;
    }

    public void setLine(boolean line) {
        this.line = line;
    }

    public int position() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    /**
     * @return The live list of comment lines
     */
    public List<Comment> list() {
        return list;
    }

    /**
     * Returns the text of the group with comment markers and the single space
     * after them removed, one line per comment.
     */
    public String text() {
        return list.stream()
                .map(Comment::text)
                .map(CommentGroup::stripMarker)
                .collect(Collectors.joining("\n"));
    }

    private static String stripMarker(String text) {
        String s = text.startsWith("//") ? text.substring(2) : text;
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    @Override
    public String toString() {
        return list.stream().map(Comment::text).collect(Collectors.joining("\n"));
    }
}
