package org.cuelang.cue.ast;

import org.cuelang.cue.token.Token;

import java.util.Objects;

/**
 * A literal of basic type: number, string, null or boolean.
 *
 * @see Token#isLiteral()
 */
public final class BasicLit extends AbstractNode implements Expr, Label {

    private final Token kind;
    private final String value;

    /**
     * @param kind  Literal kind
     * @param value Literal source text; strings include their quotes
     */
    public BasicLit(Token kind, String value) {
        Objects.requireNonNull(kind, "Kind cannot be null");
        if (!kind.isLiteral()) {
            throw new IllegalArgumentException("Not a literal token: " + kind);
        }
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public Token kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
