package org.cuelang.cue.token;

/**
 * Lexical tokens of the CUE language that the syntax tree refers to.
 */
public enum Token {
    ILLEGAL(""),

    // Literals
    IDENT(""),
    INT(""),
    FLOAT(""),
    STRING(""),
    NULL("null"),
    TRUE("true"),
    FALSE("false"),
    BOTTOM("_|_"),

    // Field relations
    COLON(":"),
    ISA("::"),
    OPTION("?"),
    BIND("="),

    // Operators
    ADD("+"),
    SUB("-"),
    MUL("*"),
    QUO("/"),
    AND("&"),
    OR("|"),
    LAND("&&"),
    LOR("||"),
    NOT("!"),
    EQL("=="),
    NEQ("!="),
    LSS("<"),
    GTR(">"),
    LEQ("<="),
    GEQ(">="),
    MAT("=~"),
    NMAT("!~");

    private final String text;

    Token(String text) {
        this.text = text;
    }

    /**
     * @return The source spelling of the token, or the empty string for
     *         tokens without a fixed spelling
     */
    public String text() {
        return text;
    }

    public boolean isLiteral() {
        return ordinal() >= INT.ordinal() && ordinal() <= BOTTOM.ordinal();
    }
}
