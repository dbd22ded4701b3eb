package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * An embedding: an expression whose value is spliced into the enclosing
 * struct instead of being bound to a field.
 */
public final class EmbedDecl extends AbstractNode implements Decl {

    private Expr expr;

    public EmbedDecl(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "Embedded expression cannot be null");
    }

    public Expr expr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "Embedded expression cannot be null");
    }
}
