package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * A parenthesized expression. As a label it computes the field name.
 */
public final class ParenExpr extends AbstractNode implements Expr, Label {

    private final Expr x;

    public ParenExpr(Expr x) {
        this.x = Objects.requireNonNull(x, "Expression cannot be null");
    }

    public Expr x() {
        return x;
    }
}
