package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Alias;
import org.cuelang.cue.ast.Decl;
import org.cuelang.cue.ast.Ellipsis;
import org.cuelang.cue.ast.Field;
import org.cuelang.cue.ast.Ident;
import org.cuelang.cue.ast.Label;
import org.cuelang.cue.ast.ListLit;
import org.cuelang.cue.token.Token;

/**
 * Classifies labels and declarations by the naming conventions of the
 * language.
 *
 * - Definition: name starts with {@code #} or {@code _#}
 * - Hidden: name starts with {@code _}
 * - Regular: neither
 *
 * All methods are pure.
 */
public final class FieldKinds {

    private FieldKinds() {
    }

    public static boolean isDefinitionName(String name) {
        return name.startsWith("#") || name.startsWith("_#");
    }

    public static boolean isHiddenName(String name) {
        return name.startsWith("_");
    }

    public static boolean isDefinitionOrHiddenName(String name) {
        return name.startsWith("#") || name.startsWith("_");
    }

    /**
     * Reports whether the label names a definition. Only identifiers, plain or
     * aliased, can name a definition.
     */
    public static boolean isDefinitionLabel(Label label) {
        Ident ident = labelIdent(label);
        return ident != null && isDefinitionName(ident.name());
    }

    /**
     * Reports whether the field is a regular field: not a type constraint,
     * not a definition and not hidden. Fields whose name cannot be determined
     * structurally, such as pattern and computed labels, count as regular.
     */
    public static boolean isRegularField(Field field) {
        if (field.token() == Token.ISA) {
            return false;
        }
        Ident ident = labelIdent(field.label());
        if (ident == null) {
            return true;
        }
        return !isDefinitionOrHiddenName(ident.name());
    }

    /**
     * Reports whether the declaration is a field with a pattern label,
     * {@code [pattern]: value}.
     */
    public static boolean isBulkOptionalField(Decl decl) {
        return decl instanceof Field field && field.label() instanceof ListLit;
    }

    /**
     * Reports whether the declaration allows any remaining fields: either
     * {@code ...} or its long-hand spellings {@code [string]: _} and
     * {@code [_]: _}.
     */
    public static boolean isRestSentinel(Decl decl) {
        if (decl instanceof Ellipsis) {
            return true;
        }
        if (!(decl instanceof Field field)) {
            return false;
        }
        if (!(field.value() instanceof Ident value) || !value.name().equals("_")) {
            return false;
        }
        if (!(field.label() instanceof ListLit pattern) || pattern.elements().size() != 1) {
            return false;
        }
        if (!(pattern.elements().get(0) instanceof Ident ident)) {
            return false;
        }
        return ident.name().equals("string") || ident.name().equals("_");
    }

    /**
     * Returns the identifier naming the label, unwrapping an alias, or null
     * when the label is not a plain name.
     */
    private static Ident labelIdent(Label label) {
        if (label instanceof Ident ident) {
            return ident;
        }
        if (label instanceof Alias alias && alias.expr() instanceof Ident ident) {
            return ident;
        }
        return null;
    }
}
