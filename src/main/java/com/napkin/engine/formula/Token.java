package com.napkin.engine.formula;

/**
 * One lexical unit of a formula body.
 */
final class Token {

    enum Type {
        NUMBER,
        REFERENCE,
        FUNCTION,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        SEMICOLON,
        COLON,
        END
    }

    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    int getPosition() {
        return position;
    }

    boolean is(Type expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
