package org.cuelang.cue.ast;

import java.util.Objects;

/**
 * An attribute, {@code @key(body)}, either on a field or as a declaration.
 */
public final class Attribute extends AbstractNode implements Decl {

    private String text;

    public Attribute(String text) {
        this.text = Objects.requireNonNull(text, "Attribute text cannot be null");
    }

    /**
     * @return The full attribute text, including the leading {@code @}
     */
    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "Attribute text cannot be null");
    }

    /**
     * @return The attribute key, the name between {@code @} and {@code (}
     */
    public String key() {
        int start = text.startsWith("@") ? 1 : 0;
        int paren = text.indexOf('(');
        return paren < 0 ? text.substring(start) : text.substring(start, paren);
    }

    /**
     * @return The text between the outer parentheses, or the empty string
     */
    public String body() {
        int open = text.indexOf('(');
        int close = text.lastIndexOf(')');
        if (open < 0 || close < open) {
            return "";
        }
        return text.substring(open + 1, close);
    }

    @Override
    public String toString() {
        return text;
    }
}
