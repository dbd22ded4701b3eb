package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Ellipsis;
import org.cuelang.cue.ast.Expr;

import java.util.List;
import java.util.Optional;

/**
 * The elements of a list literal, with its trailing ellipsis split off.
 *
 * @param elements Elements before the ellipsis
 * @param ellipsis The trailing ellipsis, if the list is open
 */
public record ListElements(List<Expr> elements, Optional<Ellipsis> ellipsis) {

    public boolean isOpen() {
        return ellipsis.isPresent();
    }
}
