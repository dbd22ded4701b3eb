package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Attribute;

/**
 * Builds attributes for generated syntax trees.
 */
public final class Attributes {

    private Attributes() {
    }

    /**
     * Creates the attribute {@code @name(body)}.
     */
    public static Attribute newAttribute(String name, String body) {
        return new Attribute("@" + name + "(" + body + ")");
    }
}
