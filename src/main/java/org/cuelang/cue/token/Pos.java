package org.cuelang.cue.token;

import java.util.Objects;

/**
 * A source position, plus the relative position class of the token at that
 * position.
 *
 * Positions are immutable; mutating a node's position means replacing its
 * {@code Pos}.
 *
 * @param offset Byte offset in the source, or -1 when unknown
 * @param line   1-based line, or 0 when unknown
 * @param column 1-based column, or 0 when unknown
 * @param relPos Relative position class
 */
public record Pos(int offset, int line, int column, RelPos relPos) {

    /** Position with no location and no relative class. */
    public static final Pos NONE = new Pos(-1, 0, 0, RelPos.NO_REL_POS);

    public Pos {
        Objects.requireNonNull(relPos, "RelPos cannot be null");
    }

    public static Pos at(int offset, int line, int column) {
        return new Pos(offset, line, column, RelPos.NO_REL_POS);
    }

    public Pos withRelPos(RelPos rel) {
        return new Pos(offset, line, column, rel);
    }

    /**
     * @return true if this position refers to an actual source location
     */
    public boolean isValid() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (!isValid()) {
            return "-";
        }
        return line + ":" + column;
    }
}
