package org.cuelang.cue.ast;

import org.cuelang.cue.token.Token;

import java.util.Objects;

/**
 * A unary expression, such as {@code -x}, {@code !x} or {@code >=0}.
 */
public final class UnaryExpr extends AbstractNode implements Expr {

    private final Token op;
    private final Expr x;

    public UnaryExpr(Token op, Expr x) {
        this.op = Objects.requireNonNull(op, "Operator cannot be null");
        this.x = Objects.requireNonNull(x, "Operand cannot be null");
    }

    public Token op() {
        return op;
    }

    public Expr x() {
        return x;
    }
}
