package org.cuelang.cue.ast;

import org.cuelang.cue.token.Pos;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A struct literal, {@code { decls }}.
 *
 * The struct owns its element list until it is handed over with
 * {@link #surrender()}. A surrendered struct no longer has elements: any
 * later access to them fails with {@link IllegalStateException}.
 *
 * The position of a struct is the position of its opening brace.
 */
public final class StructLit extends AbstractNode implements Expr, Decl {

    private Pos lbrace = Pos.NONE;
    private Pos rbrace = Pos.NONE;
    private List<Decl> elts;

    public StructLit() {
        this(new ArrayList<>());
    }

    /**
     * Creates a struct that takes ownership of the given element list.
     */
    public StructLit(List<Decl> elts) {
        this.elts = elts == null ? new ArrayList<>() : elts;
    }

    /**
     * @return The live, mutable element list
     * @throws IllegalStateException if the elements were surrendered
     */
    public List<Decl> elements() {
        checkNotSurrendered();
        return elts;
    }

    /**
     * Hands the element list over to the caller. After this call the struct
     * must not be used as a container any more.
     *
     * @return The element list, now owned by the caller
     * @throws IllegalStateException if the elements were already surrendered
     */
    public List<Decl> surrender() {
        checkNotSurrendered();
        List<Decl> moved = elts;
        elts = null;
        return moved;
    }

    public boolean isSurrendered() {
        return elts == null;
    }

    public Pos lbrace() {
        return lbrace;
    }

    public void setLbrace(Pos lbrace) {
        this.lbrace = Objects.requireNonNull(lbrace, "Pos cannot be null");
    }

    public Pos rbrace() {
        return rbrace;
    }

    public void setRbrace(Pos rbrace) {
        this.rbrace = Objects.requireNonNull(rbrace, "Pos cannot be null");
    }

    @Override
    public Pos pos() {
        return lbrace;
    }

    @Override
    public void setPos(Pos pos) {
        setLbrace(pos);
    }

    private void checkNotSurrendered() {
        if (elts == null) {
            throw new IllegalStateException("Struct literal has surrendered its elements");
        }
    }
}
