package org.cuelang.cue.errors;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sentinel errors and identity matching.
 */
public final class Errors {

    /**
     * Signals that an evaluation could not complete, for instance because a
     * value is not concrete yet.
     */
    public static final CueException INCOMPLETE = sentinel("incomplete value");

    /**
     * Signals that a subsumption check could not give an exact answer.
     */
    public static final CueException INEXACT = sentinel("inexact subsumption");

    private Errors() {
    }

    /**
     * Creates a new sentinel error. Sentinels have no stack trace and are
     * meant to be compared by identity.
     */
    public static CueException sentinel(String message) {
        return new CueException(message, false);
    }

    /**
     * Reports whether {@code err}, or any error in its cause chain, is or
     * matches {@code target}.
     */
    public static boolean is(Throwable err, Throwable target) {
        if (err == null || target == null) {
            return err == target;
        }
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        for (Throwable e = err; e != null && seen.put(e, Boolean.TRUE) == null; e = e.getCause()) {
            if (e == target) {
                return true;
            }
            if (e instanceof CueException cue && cue.matches(target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wraps {@code primary} so that it also matches {@code info}.
     *
     * The result reports the message and position of {@code primary}; it
     * matches a target if either {@code info} or {@code primary} does.
     */
    public static CueException decorate(Throwable info, CueException primary) {
        Objects.requireNonNull(primary, "Primary error cannot be null");
        return new DecoratedException(info, primary);
    }
}
