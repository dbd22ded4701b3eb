package org.cuelang.cue.ast;

import org.cuelang.cue.token.Pos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Position and comment storage shared by all node classes.
 */
abstract class AbstractNode {

    private Pos pos = Pos.NONE;
    private List<CommentGroup> comments = new ArrayList<>();

    public Pos pos() {
        return pos;
    }

    public void setPos(Pos pos) {
        this.pos = Objects.requireNonNull(pos, "Pos cannot be null");
    }

    public List<CommentGroup> comments() {
        return Collections.unmodifiableList(comments);
    }

    public void addComment(CommentGroup comment) {
        comments.add(Objects.requireNonNull(comment, "Comment cannot be null"));
    }

    public void setComments(List<CommentGroup> comments) {
        this.comments = comments == null ? new ArrayList<>() : new ArrayList<>(comments);
    }
}
