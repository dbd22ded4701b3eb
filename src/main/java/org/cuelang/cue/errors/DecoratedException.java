package org.cuelang.cue.errors;

import org.cuelang.cue.token.Pos;

/**
 * A primary error decorated with a secondary error.
 *
 * Message, position and cause are those of the primary error. The decorated
 * error matches a target when either the secondary or the primary does.
 */
final class DecoratedException extends CueException {

    private final Throwable info;
    private final CueException primary;

    DecoratedException(Throwable info, CueException primary) {
        super(primary.getMessage(), primary.position(), primary);
        this.info = info;
        this.primary = primary;
    }

    @Override
    public boolean matches(Throwable target) {
        return Errors.is(info, target) || Errors.is(primary, target);
    }

    @Override
    public Pos position() {
        return primary.position();
    }

    @Override
    public String getMessage() {
        return primary.getMessage();
    }

    @Override
    public String toString() {
        return primary.toString();
    }
}
