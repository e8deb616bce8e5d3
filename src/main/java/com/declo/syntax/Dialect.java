package com.declo.syntax;

import com.declo.expr.BinaryOperator;
import com.declo.expr.UnaryOperator;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Spelling and precedence of the two surfaces. Higher levels bind tighter.
 */
public enum Dialect {
    /** JavaScript-style chain: {@code nums.filter(x => x > 2)}. */
    CHAIN(7, 8, '"', "true", "false", "null",
          Sets.immutable.of("true", "false", "null", "function", "return", "if", "else", "for",
                  "in", "new", "typeof", "instanceof", "var", "let", "const", "this", "void",
                  "delete", "while", "do", "class")),

    /** Python-style list comprehension: {@code [x for x in nums if x > 2]}. */
    COMPREHENSION(8, 7, '\'', "True", "False", "None",
          Sets.immutable.of("True", "False", "None", "and", "or", "not", "for", "in", "if", "else",
                  "lambda", "is", "def", "return", "class", "while", "yield", "async", "await",
                  "import", "from", "pass", "del", "global", "with", "as"));

    public static final int LEVEL_OR = 1;
    public static final int LEVEL_AND = 2;
    public static final int LEVEL_NOT_WORD = 3;
    public static final int LEVEL_COMPARISON = 4;
    public static final int LEVEL_ADDITIVE = 5;
    public static final int LEVEL_MULTIPLICATIVE = 6;
    public static final int LEVEL_POSTFIX = 9;
    public static final int LEVEL_ATOM = 10;

    private final int powerLevel;
    private final int unaryLevel;
    private final char quote;
    private final String trueWord;
    private final String falseWord;
    private final String nullWord;
    private final ImmutableSet<String> reserved;

    Dialect(int powerLevel, int unaryLevel, char quote, String trueWord, String falseWord,
            String nullWord, ImmutableSet<String> reserved) {
        this.powerLevel = powerLevel;
        this.unaryLevel = unaryLevel;
        this.quote = quote;
        this.trueWord = trueWord;
        this.falseWord = falseWord;
        this.nullWord = nullWord;
        this.reserved = reserved;
    }

    public String spelling(BinaryOperator operator) {
        return switch (operator) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case MOD -> "%";
            case POW -> "**";
            case EQ -> "==";
            case NE -> "!=";
            case LT -> "<";
            case LE -> "<=";
            case GT -> ">";
            case GE -> ">=";
            case AND -> this == CHAIN ? "&&" : "and";
            case OR -> this == CHAIN ? "||" : "or";
        };
    }

    public String spelling(UnaryOperator operator) {
        return switch (operator) {
            case NEG -> "-";
            case NOT -> this == CHAIN ? "!" : "not ";
        };
    }

    /**
     * Maps a comparison token to its operator, or null when the token is not
     * a comparison in this dialect.
     */
    public BinaryOperator comparison(String text) {
        switch (text) {
            case "==":
                return BinaryOperator.EQ;
            case "!=":
                return BinaryOperator.NE;
            case "<":
                return BinaryOperator.LT;
            case "<=":
                return BinaryOperator.LE;
            case ">":
                return BinaryOperator.GT;
            case ">=":
                return BinaryOperator.GE;
            case "===":
                return this == CHAIN ? BinaryOperator.EQ : null;
            case "!==":
                return this == CHAIN ? BinaryOperator.NE : null;
            default:
                return null;
        }
    }

    public int precedence(BinaryOperator operator) {
        return switch (operator) {
            case OR -> LEVEL_OR;
            case AND -> LEVEL_AND;
            case EQ, NE, LT, LE, GT, GE -> LEVEL_COMPARISON;
            case ADD, SUB -> LEVEL_ADDITIVE;
            case MUL, DIV, MOD -> LEVEL_MULTIPLICATIVE;
            case POW -> powerLevel;
        };
    }

    public int precedence(UnaryOperator operator) {
        if (operator == UnaryOperator.NOT && this == COMPREHENSION) {
            return LEVEL_NOT_WORD;
        }
        return unaryLevel;
    }

    /** Lowest level allowed on the right of {@code **}, which admits unary operands. */
    public int powerRightLevel() {
        return Math.min(powerLevel, unaryLevel);
    }

    public char quote() {
        return quote;
    }

    public String trueWord() {
        return trueWord;
    }

    public String falseWord() {
        return falseWord;
    }

    public String nullWord() {
        return nullWord;
    }

    public boolean isReserved(String word) {
        return reserved.contains(word);
    }

    /** The surface a translation from this one produces. */
    public Dialect counterpart() {
        return this == CHAIN ? COMPREHENSION : CHAIN;
    }

    public String languageName() {
        return this == CHAIN ? "JavaScript" : "Python";
    }

    public boolean hasLineComment(char first, char next) {
        return this == CHAIN ? first == '/' && next == '/' : first == '#';
    }
}
