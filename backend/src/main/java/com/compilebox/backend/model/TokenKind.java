package com.compilebox.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a {@link Token}, serialized as the dotted name editors
 * map to highlight scopes.
 */
public enum TokenKind {
    KEYWORD("keyword"),
    IDENTIFIER("identifier"),
    BUILT_IN_TYPE("type.builtin"),
    BUILT_IN_FUNCTION("function.builtin"),
    STRING_LITERAL("string"),
    NUMBER_LITERAL("number"),
    COMMENT("comment"),
    OPERATOR("operator"),
    USER_FUNCTION("function.user"),
    USER_VARIABLE("variable.user"),
    FUNCTION_PARAMETER("variable.parameter"),
    IMPORTED_CLASS("class.imported"),
    IMPORTED_FUNCTION("function.imported");

    private final String wireName;

    TokenKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Literal and comment tokens carry text that is never a symbol name. */
    public boolean isLiteral() {
        return this == STRING_LITERAL || this == COMMENT || this == NUMBER_LITERAL;
    }
}
