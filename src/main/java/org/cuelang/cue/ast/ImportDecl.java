package org.cuelang.cue.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An import declaration with one or more import specs.
 */
public final class ImportDecl extends AbstractNode implements Decl {

    private final List<ImportSpec> specs;

    public ImportDecl(List<ImportSpec> specs) {
        this.specs = specs == null ? new ArrayList<>() : new ArrayList<>(specs);
    }

    public List<ImportSpec> specs() {
        return specs;
    }
}
