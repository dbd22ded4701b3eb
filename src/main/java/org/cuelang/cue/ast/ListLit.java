package org.cuelang.cue.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A list literal, {@code [a, b, ...T]}. As a label it is a pattern matching
 * a set of field names, {@code [string]: T}.
 */
public final class ListLit extends AbstractNode implements Expr, Label {

    private final List<Expr> elts;

    public ListLit(List<Expr> elts) {
        this.elts = elts == null ? new ArrayList<>() : new ArrayList<>(elts);
    }

    public List<Expr> elements() {
        return elts;
    }
}
