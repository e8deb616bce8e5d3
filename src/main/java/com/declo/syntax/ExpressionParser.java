package com.declo.syntax;

import com.declo.expr.BinaryOperator;
import com.declo.expr.Expr;
import com.declo.expr.UnaryOperator;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Recursive-descent parser for the scalar expression subset shared by both
 * surfaces. Subclasses parse the surrounding chain or comprehension and
 * supply the dialect.
 */
public abstract class ExpressionParser {
    protected final Dialect dialect;

    private String source = "";
    private ImmutableList<Token> tokens = Lists.immutable.empty();
    private int position;

    protected ExpressionParser(Dialect dialect) {
        this.dialect = dialect;
    }

    protected void reset(String text) {
        if (text == null) {
            throw new DecloSyntaxException("no input", "", 0, "");
        }
        this.source = text;
        this.tokens = new Lexer(text, dialect).tokenize();
        this.position = 0;
    }

    // ------------------------------------------------------------
    // Token cursor
    // ------------------------------------------------------------

    protected Token peek() {
        return peek(0);
    }

    protected Token peek(int ahead) {
        int index = Math.min(position + ahead, tokens.size() - 1);
        return tokens.get(index);
    }

    protected Token advance() {
        Token token = peek();
        if (token.type() != Token.Type.EOF) {
            position++;
        }
        return token;
    }

    protected boolean acceptSymbol(String symbol) {
        if (peek().isSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean acceptWord(String word) {
        if (peek().isWord(word)) {
            advance();
            return true;
        }
        return false;
    }

    /** Accepts an operator spelled either as a symbol ({@code &&}) or as a word ({@code and}). */
    protected boolean acceptOperator(String spelling) {
        return acceptSymbol(spelling) || acceptWord(spelling);
    }

    protected Token expectSymbol(String symbol) {
        if (!peek().isSymbol(symbol)) {
            throw error("expected '" + symbol + "'");
        }
        return advance();
    }

    protected void expectWord(String word) {
        if (!acceptWord(word)) {
            throw error("expected '" + word + "'");
        }
    }

    protected String expectIdentifier() {
        Token token = peek();
        if (token.type() != Token.Type.IDENT) {
            throw error("expected an identifier");
        }
        if (dialect.isReserved(token.text())) {
            throw error("'" + token.text() + "' is a reserved word");
        }
        // A name the other surface reserves could not be written back out
        Dialect counterpart = dialect.counterpart();
        if (counterpart.isReserved(token.text())) {
            throw error("'" + token.text() + "' is a reserved word in " + counterpart.languageName()
                    + " and cannot be translated");
        }
        advance();
        return token.text();
    }

    protected void expectEnd() {
        if (peek().type() != Token.Type.EOF) {
            throw error("unexpected trailing input");
        }
    }

    protected DecloSyntaxException error(String reason) {
        Token token = peek();
        return new DecloSyntaxException(reason, source, token.offset(), token.display());
    }

    // ------------------------------------------------------------
    // Expressions, lowest precedence first
    // ------------------------------------------------------------

    public Expr parseExpression() {
        return parseOr();
    }

    protected Expr parseOr() {
        Expr left = parseAnd();
        while (acceptOperator(dialect.spelling(BinaryOperator.OR))) {
            left = new Expr.Binary(BinaryOperator.OR, left, parseAnd());
        }
        return left;
    }

    protected Expr parseAnd() {
        Expr left = parseNot();
        while (acceptOperator(dialect.spelling(BinaryOperator.AND))) {
            left = new Expr.Binary(BinaryOperator.AND, left, parseNot());
        }
        return left;
    }

    /** Word-form {@code not} binds looser than comparisons. */
    protected Expr parseNot() {
        if (dialect == Dialect.COMPREHENSION && acceptWord("not")) {
            return new Expr.Unary(UnaryOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    protected Expr parseComparison() {
        Expr left = parseAdditive();
        BinaryOperator operator = comparisonAhead();
        if (operator == null) {
            return left;
        }
        advance();
        Expr right = parseAdditive();
        if (comparisonAhead() != null) {
            throw error("chained comparisons are not supported");
        }
        return new Expr.Binary(operator, left, right);
    }

    private BinaryOperator comparisonAhead() {
        Token token = peek();
        return token.type() == Token.Type.SYMBOL ? dialect.comparison(token.text()) : null;
    }

    protected Expr parseAdditive() {
        Expr left = parseMultiplicative();
        while (true) {
            if (acceptSymbol("+")) {
                left = new Expr.Binary(BinaryOperator.ADD, left, parseMultiplicative());
            } else if (acceptSymbol("-")) {
                left = new Expr.Binary(BinaryOperator.SUB, left, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    protected Expr parseMultiplicative() {
        Expr left = parseUnary();
        while (true) {
            if (acceptSymbol("*")) {
                left = new Expr.Binary(BinaryOperator.MUL, left, parseUnary());
            } else if (acceptSymbol("/")) {
                left = new Expr.Binary(BinaryOperator.DIV, left, parseUnary());
            } else if (acceptSymbol("%")) {
                left = new Expr.Binary(BinaryOperator.MOD, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    protected Expr parseUnary() {
        if (acceptSymbol("-")) {
            return new Expr.Unary(UnaryOperator.NEG, parseUnary());
        }
        if (dialect == Dialect.CHAIN && acceptSymbol("!")) {
            return new Expr.Unary(UnaryOperator.NOT, parseUnary());
        }
        return parsePower();
    }

    /** {@code **} is right-associative and admits a unary right operand. */
    protected Expr parsePower() {
        Expr base = parsePostfix();
        if (acceptSymbol("**")) {
            return new Expr.Binary(BinaryOperator.POW, base, parseUnary());
        }
        return base;
    }

    protected Expr parsePostfix() {
        return continuePostfix(parsePrimary(), false);
    }

    /**
     * Applies attribute, call and index suffixes to {@code expr}. With
     * {@code stopBeforeStages} the loop leaves a stage call such as
     * {@code .filter(} for the caller.
     */
    protected Expr continuePostfix(Expr expr, boolean stopBeforeStages) {
        while (true) {
            if (peek().isSymbol(".")) {
                if (stopBeforeStages && isStageAhead()) {
                    return expr;
                }
                advance();
                Token name = peek();
                if (name.type() != Token.Type.IDENT) {
                    throw error("expected an attribute name");
                }
                advance();
                expr = new Expr.Attribute(expr, name.text());
            } else if (acceptSymbol("(")) {
                expr = new Expr.Call(expr, parseArguments(")"));
            } else if (acceptSymbol("[")) {
                Expr index = parseExpression();
                expectSymbol("]");
                expr = new Expr.Index(expr, index);
            } else {
                return expr;
            }
        }
    }

    /** Called with the cursor on a {@code .}. */
    protected boolean isStageAhead() {
        return false;
    }

    protected Expr parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case INT:
                advance();
                try {
                    return new Expr.IntLiteral(Long.parseLong(token.text()));
                } catch (NumberFormatException e) {
                    throw new DecloSyntaxException("integer literal out of range", source,
                            token.offset(), token.text(), e);
                }
            case FLOAT:
                advance();
                double value = Double.parseDouble(token.text());
                if (Double.isInfinite(value)) {
                    throw new DecloSyntaxException("float literal out of range", source,
                            token.offset(), token.text());
                }
                return new Expr.FloatLiteral(value);
            case STRING:
                advance();
                return new Expr.StringLiteral(token.text());
            case IDENT:
                return parseWord(token);
            case SYMBOL:
                if (token.isSymbol("(")) {
                    if (isArrowAhead(1)) {
                        throw error("arrow functions are only supported as filter/map arguments");
                    }
                    advance();
                    Expr inner = parseExpression();
                    expectSymbol(")");
                    return inner;
                }
                if (token.isSymbol("[")) {
                    advance();
                    return parseListLiteral();
                }
                if (token.isSymbol("{")) {
                    advance();
                    return parseMapLiteral();
                }
                throw error("unexpected token");
            default:
                throw error("unexpected end of input");
        }
    }

    private Expr parseWord(Token token) {
        String word = token.text();
        if (word.equals(dialect.trueWord())) {
            advance();
            return new Expr.BoolLiteral(true);
        }
        if (word.equals(dialect.falseWord())) {
            advance();
            return new Expr.BoolLiteral(false);
        }
        if (word.equals(dialect.nullWord())) {
            advance();
            return new Expr.NullLiteral();
        }
        if (peek(1).isSymbol("=>")) {
            throw error("arrow functions are only supported as filter/map arguments");
        }
        return new Expr.Identifier(expectIdentifier());
    }

    /** True when the tokens at {@code offset} read {@code IDENT ) =>}, i.e. a parenthesised arrow parameter. */
    protected boolean isArrowAhead(int offset) {
        return peek(offset).type() == Token.Type.IDENT
                && peek(offset + 1).isSymbol(")")
                && peek(offset + 2).isSymbol("=>");
    }

    protected ImmutableList<Expr> parseArguments(String closer) {
        MutableList<Expr> arguments = Lists.mutable.empty();
        if (acceptSymbol(closer)) {
            return arguments.toImmutable();
        }
        do {
            arguments.add(parseExpression());
        } while (acceptSymbol(","));
        expectSymbol(closer);
        return arguments.toImmutable();
    }

    private Expr parseListLiteral() {
        MutableList<Expr> elements = Lists.mutable.empty();
        if (acceptSymbol("]")) {
            return new Expr.ListLiteral(elements.toImmutable());
        }
        do {
            elements.add(parseExpression());
            if (peek().isWord("for")) {
                throw error("nested comprehensions are not supported");
            }
        } while (acceptSymbol(","));
        expectSymbol("]");
        return new Expr.ListLiteral(elements.toImmutable());
    }

    private Expr parseMapLiteral() {
        MutableList<Expr.Entry> entries = Lists.mutable.empty();
        if (acceptSymbol("}")) {
            return new Expr.MapLiteral(entries.toImmutable());
        }
        do {
            Expr key = parseMapKey();
            expectSymbol(":");
            entries.add(new Expr.Entry(key, parseExpression()));
        } while (acceptSymbol(","));
        expectSymbol("}");
        return new Expr.MapLiteral(entries.toImmutable());
    }

    /**
     * Python keys are ordinary expressions. JavaScript object keys are bare
     * names or literals, with {@code [expr]} for computed keys.
     */
    protected Expr parseMapKey() {
        if (dialect == Dialect.COMPREHENSION) {
            return parseExpression();
        }
        Token token = peek();
        if (token.type() == Token.Type.IDENT) {
            advance();
            return new Expr.StringLiteral(token.text());
        }
        if (acceptSymbol("[")) {
            Expr key = parseExpression();
            expectSymbol("]");
            return key;
        }
        if (token.type() == Token.Type.STRING || token.type() == Token.Type.INT
                || token.type() == Token.Type.FLOAT) {
            return parsePrimary();
        }
        throw error("expected an object key");
    }
}
