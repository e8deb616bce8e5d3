package com.declo.syntax;

import com.declo.comprehension.Comprehension;
import com.declo.expr.Expr;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses one comprehension assignment:
 * <pre>
 *   [target =] [output for variable in source (if clause)*]
 * </pre>
 */
public class ComprehensionParser extends ExpressionParser {

    public ComprehensionParser() {
        super(Dialect.COMPREHENSION);
    }

    public Comprehension parse(String text) {
        reset(text);

        String target = null;
        if (peek().type() == Token.Type.IDENT && peek(1).isSymbol("=")) {
            target = expectIdentifier();
            expectSymbol("=");
        }

        expectSymbol("[");
        Expr output = parseExpression();
        if (peek().isWord("if")) {
            throw error("conditional expressions are not supported");
        }
        expectWord("for");
        String variable = expectIdentifier();
        if (peek().isSymbol(",")) {
            throw error("tuple targets are not supported");
        }
        expectWord("in");
        Expr source = parseExpression();

        MutableList<Expr> clauses = Lists.mutable.empty();
        while (acceptWord("if")) {
            clauses.add(parseExpression());
        }
        if (peek().isWord("for")) {
            throw error("multiple for clauses are not supported");
        }
        expectSymbol("]");
        expectEnd();

        return new Comprehension(target, variable, source, clauses.toImmutable(), output);
    }
}
