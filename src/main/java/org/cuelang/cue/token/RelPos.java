package org.cuelang.cue.token;

/**
 * Relative position of a token with respect to the token before it.
 *
 * The formatter uses this class to decide how two tokens are separated:
 * - NO_SPACE: directly adjacent
 * - BLANK: same line, separated by a space
 * - NEWLINE: on the next line
 * - NEW_SECTION: on a new line with a blank line before it
 */
public enum RelPos {
    /** No relative position information */
    NO_REL_POS,
    /** Token was elided from the source */
    ELIDED,
    NO_SPACE,
    BLANK,
    NEWLINE,
    NEW_SECTION;

    /**
     * Creates a position carrying only this relative class.
     */
    public Pos pos() {
        return Pos.NONE.withRelPos(this);
    }
}
