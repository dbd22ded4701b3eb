package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * A single import: an optional local name and an import path.
 */
public final class ImportSpec extends AbstractNode implements Node {

    private Ident name;
    private BasicLit path;

    public ImportSpec(Ident name, BasicLit path) {
        this.name = name;
        this.path = Objects.requireNonNull(path, "Import path cannot be null");
    }

    /**
     * @return The local name of the import, or null when the default is used
     */
    public Ident name() {
        return name;
    }

    public void setName(Ident name) {
        this.name = name;
    }

    public BasicLit path() {
        return path;
    }

    public void setPath(BasicLit path) {
        this.path = Objects.requireNonNull(path, "Import path cannot be null");
    }
}
