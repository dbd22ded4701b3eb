package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Package;
import org.cuelang.cue.token.Pos;

import java.util.Objects;
import java.util.Optional;

/**
 * The result of looking up the package clause of a file.
 *
 * @param clause   The package clause, if the file has one
 * @param name     The declared package name, empty if there is no clause or
 *                 the clause has no name
 * @param position Position of the package name, or of the file start when
 *                 there is no clause
 */
public record PackageInfo(Optional<Package> clause, String name, Pos position) {

    public PackageInfo {
        Objects.requireNonNull(clause, "Clause cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    static PackageInfo notFound(Pos fileStart) {
        return new PackageInfo(Optional.empty(), "", fileStart);
    }

    public boolean isFound() {
        return clause.isPresent();
    }
}
