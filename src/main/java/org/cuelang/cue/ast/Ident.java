package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * An identifier. The top value is the identifier {@code _}.
 */
public final class Ident extends AbstractNode implements Expr, Label {

    private final String name;

    public Ident(String name) {
        this.name = Objects.requireNonNull(name, "Identifier name cannot be null");
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
