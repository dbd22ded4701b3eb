package org.cuelang.cue.ast;

/**
 * A package clause: {@code package name}.
 */
public final class Package extends AbstractNode implements Decl {

    private Ident name;

    public Package(Ident name) {
        this.name = name;
    }

    /**
     * @return The package name, or null if the clause has none
     */
    public Ident name() {
        return name;
    }

    public void setName(Ident name) {
        this.name = name;
    }
}
