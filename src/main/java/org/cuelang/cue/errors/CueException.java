package org.cuelang.cue.errors;

import org.cuelang.cue.token.Pos;

import java.util.Objects;

/**
 * A recoverable CUE domain error.
 *
 * Errors are recognized by identity, not by message: callers compare against
 * well-known sentinel instances with {@link Errors#is(Throwable, Throwable)}.
 * Subclasses that wrap other errors override {@link #matches(Throwable)} to
 * take part in that comparison.
 */
public class CueException extends RuntimeException {

    private final Pos position;

    public CueException(String message) {
        this(message, Pos.NONE);
    }

    public CueException(String message, Pos position) {
        super(message);
        this.position = Objects.requireNonNull(position, "Pos cannot be null");
    }

    public CueException(String message, Pos position, Throwable cause) {
        super(message, cause);
        this.position = Objects.requireNonNull(position, "Pos cannot be null");
    }

    /**
     * Constructor for sentinel errors, which carry no stack trace.
     */
    protected CueException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
        this.position = Pos.NONE;
    }

    public Pos position() {
        return position;
    }

    public boolean hasPosition() {
        return position.isValid();
    }

    /**
     * Reports whether this error should be treated as {@code target}.
     * The default is identity.
     */
    public boolean matches(Throwable target) {
        return this == target;
    }
}
