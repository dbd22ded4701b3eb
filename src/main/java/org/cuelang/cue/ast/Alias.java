package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * An aliased label, {@code X=label}. The alias {@link #ident()} names the
 * field value; {@link #expr()} is the actual label, normally an identifier.
 */
public final class Alias extends AbstractNode implements Label {

    private final Ident ident;
    private Expr expr;

    public Alias(Ident ident, Expr expr) {
        this.ident = Objects.requireNonNull(ident, "Alias identifier cannot be null");
        this.expr = Objects.requireNonNull(expr, "Aliased expression cannot be null");
    }

    public Ident ident() {
        return ident;
    }

    public Expr expr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "Aliased expression cannot be null");
    }
}
