package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * A single {@code //} comment line.
 *
 * @see CommentGroup
 */
public final class Comment extends AbstractNode implements Node {

    private final String text;

    public Comment(String text) {
        this.text = Objects.requireNonNull(text, "Comment text cannot be null");
    }

    /**
     * @return The comment text, including the {@code //} marker
     */
    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
