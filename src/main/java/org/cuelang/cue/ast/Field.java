package org.cuelang.cue.ast;

import org.cuelang.cue.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A field declaration, {@code label: value}.
 *
 * The relation token distinguishes an ordinary field ({@link Token#COLON})
 * from a type-constraint field ({@link Token#ISA}).
 */
public final class Field extends AbstractNode implements Decl {

    private Label label;
    private boolean optional;
    private Token token;
    private Expr value;
    private final List<Attribute> attrs = new ArrayList<>();

    public Field(Label label, Expr value) {
        this(label, Token.COLON, value);
    }

    public Field(Label label, Token token, Expr value) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
        this.token = Objects.requireNonNull(token, "Token cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public Label label() {
        return label;
    }

    public void setLabel(Label label) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    public Token token() {
        return token;
    }

    public void setToken(Token token) {
        this.token = Objects.requireNonNull(token, "Token cannot be null");
    }

    public Expr value() {
        return value;
    }

    public void setValue(Expr value) {
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public List<Attribute> attrs() {
        return attrs;
    }
}
