package com.declo.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class Lexer {
    private static final String[] SYMBOLS = {
        "===", "!==",
        "**", "==", "!=", "<=", ">=", "&&", "||", "=>",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "<", ">", "+", "-", "*", "/", "%", "!", "="
    };

    private final String source;
    private final Dialect dialect;
    private int pos = 0;

    public Lexer(String source, Dialect dialect) {
        this.source = source;
        this.dialect = dialect;
    }

    public ImmutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", source.length()));
                return tokens.toImmutable();
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = source.charAt(pos);
        int start = pos;

        if (isIdentifierStart(c)) {
            pos++;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return new Token(Token.Type.IDENT, source.substring(start, pos), start);
        }

        if (Character.isDigit(c)) {
            return number(start);
        }

        if (c == '"' || c == '\'') {
            return string(start, c);
        }

        for (String symbol : SYMBOLS) {
            if (source.startsWith(symbol, pos)) {
                pos += symbol.length();
                return new Token(Token.Type.SYMBOL, symbol, start);
            }
        }

        throw new DecloSyntaxException("unexpected character", source, start, String.valueOf(c));
    }

    private Token number(int start) {
        boolean isFloat = false;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        // Only take the dot when a digit follows, so "1.foo" stays an attribute access
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                isFloat = true;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        if (pos < source.length() && isIdentifierStart(source.charAt(pos))) {
            throw new DecloSyntaxException("invalid number literal", source, start,
                    source.substring(start, pos + 1));
        }
        return new Token(isFloat ? Token.Type.FLOAT : Token.Type.INT, source.substring(start, pos), start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos++);
            if (ch == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (ch == '\n') {
                break;
            }
            if (ch == '\\') {
                if (pos >= source.length()) {
                    break;
                }
                escape(sb);
            } else {
                sb.append(ch);
            }
        }
        throw new DecloSyntaxException("unterminated string literal", source, start,
                source.substring(start, Math.min(pos, source.length())));
    }

    /** Decodes the escape after a backslash. Escapes shared by both surfaces, plus Python's {@code \U}. */
    private void escape(StringBuilder sb) {
        int at = pos - 1;
        char escaped = source.charAt(pos++);
        switch (escaped) {
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append((char) 0x0B);
            case '\\', '\'', '"' -> sb.append(escaped);
            case '0' -> {
                // "\01" is an octal escape in Python and a syntax error in strict JavaScript
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    throw unsupportedEscape(at);
                }
                sb.append('\0');
            }
            case 'x' -> sb.append((char) hexEscape(at, 2));
            case 'u' -> sb.append((char) hexEscape(at, 4));
            case 'U' -> {
                if (dialect != Dialect.COMPREHENSION) {
                    throw unsupportedEscape(at);
                }
                int codePoint = hexEscape(at, 8);
                if (!Character.isValidCodePoint(codePoint)) {
                    throw new DecloSyntaxException("bad \\U escape", source, at, source.substring(at, pos));
                }
                sb.appendCodePoint(codePoint);
            }
            default -> throw unsupportedEscape(at);
        }
    }

    private DecloSyntaxException unsupportedEscape(int at) {
        return new DecloSyntaxException("unsupported escape", source, at,
                source.substring(at, Math.min(at + 2, source.length())));
    }

    private int hexEscape(int at, int digits) {
        char kind = source.charAt(pos - 1);
        if (pos + digits > source.length()) {
            throw new DecloSyntaxException("bad \\" + kind + " escape", source, at, source.substring(at));
        }
        String hex = source.substring(pos, pos + digits);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new DecloSyntaxException("bad \\" + kind + " escape", source, at, "\\" + kind + hex);
            }
        }
        pos += digits;
        return (int) Long.parseLong(hex, 16);
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            char next = pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (dialect.hasLineComment(c, next)) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (dialect == Dialect.CHAIN && c == '/' && next == '*') {
                int end = source.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new DecloSyntaxException("unterminated comment", source, pos, "/*");
                }
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || (c == '$' && dialect == Dialect.CHAIN);
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }
}
