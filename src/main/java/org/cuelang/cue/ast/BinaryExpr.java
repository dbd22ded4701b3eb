package org.cuelang.cue.ast;

import org.cuelang.cue.token.Token;

import java.util.Objects;

/**
 * A binary expression, {@code x op y}.
 */
public final class BinaryExpr extends AbstractNode implements Expr {

    private final Expr x;
    private final Token op;
    private final Expr y;

    public BinaryExpr(Expr x, Token op, Expr y) {
        this.x = Objects.requireNonNull(x, "Left operand cannot be null");
        this.op = Objects.requireNonNull(op, "Operator cannot be null");
        this.y = Objects.requireNonNull(y, "Right operand cannot be null");
    }

    public Expr x() {
        return x;
    }

    public Token op() {
        return op;
    }

    public Expr y() {
        return y;
    }
}
