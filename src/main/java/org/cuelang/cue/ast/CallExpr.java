package org.cuelang.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A call, {@code fun(args)}.
 */
public final class CallExpr extends AbstractNode implements Expr {

    private final Expr fun;
    private final List<Expr> args;

    public CallExpr(Expr fun, List<Expr> args) {
        this.fun = Objects.requireNonNull(fun, "Function cannot be null");
        this.args = args == null ? new ArrayList<>() : new ArrayList<>(args);
    }

    public Expr fun() {
        return fun;
    }

    public List<Expr> args() {
        return args;
    }
}
