package com.declo.syntax;

public record Token(Type type, String text, int offset) {

    public enum Type {
        IDENT,
        INT,
        FLOAT,
        STRING,
        SYMBOL,
        EOF
    }

    public boolean is(Type expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    public boolean isSymbol(String symbol) {
        return is(Type.SYMBOL, symbol);
    }

    public boolean isWord(String word) {
        return is(Type.IDENT, word);
    }

    /** Text to quote in error messages. */
    public String display() {
        return type == Type.STRING ? "\"" + text + "\"" : text;
    }
}
