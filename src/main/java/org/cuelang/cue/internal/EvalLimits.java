package org.cuelang.cue.internal;

/**
 * Limits shared with the evaluator.
 */
public final class EvalLimits {

    /**
     * Maximum evaluation depth. Evaluation beyond this depth is cut off to
     * break reference cycles; all places that break cycles this way refer to
     * this constant.
     */
    public static final int MAX_DEPTH = 20;

    private EvalLimits() {
    }
}
