package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * A selector, {@code x.sel}.
 */
public final class SelectorExpr extends AbstractNode implements Expr {

    private final Expr x;
    private final Ident sel;

    public SelectorExpr(Expr x, Ident sel) {
        this.x = Objects.requireNonNull(x, "Expression cannot be null");
        this.sel = Objects.requireNonNull(sel, "Selector cannot be null");
    }

    public Expr x() {
        return x;
    }

    public Ident sel() {
        return sel;
    }
}
