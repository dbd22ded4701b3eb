package org.cuelang.cue.ast;

/**
 * The bottom value, {@code _|_}.
 */
public final class BottomLit extends AbstractNode implements Expr {
}
