package org.cuelang.cue.ast;

/**
 * An ellipsis, {@code ...} or {@code ...T}.
 *
 * In a struct it allows any remaining fields; at the end of a list it allows
 * additional elements of type T.
 */
public final class Ellipsis extends AbstractNode implements Decl, Expr {

    private Expr type;

    public Ellipsis() {
        this(null);
    }

    public Ellipsis(Expr type) {
        this.type = type;
    }

    /**
     * @return The element type, or null for a bare {@code ...}
     */
    public Expr type() {
        return type;
    }

    public void setType(Expr type) {
        this.type = type;
    }
}
