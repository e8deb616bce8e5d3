package com.declo.syntax;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.expr.Expr;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses one chain assignment:
 * <pre>
 *   [const|let|var] [target =] source(.filter(p => expr) | .map(p => expr))* [;]
 * </pre>
 */
public class ChainParser extends ExpressionParser {

    public ChainParser() {
        super(Dialect.CHAIN);
    }

    public StageSequence parse(String text) {
        reset(text);

        String target = parseTarget();
        Expr source = continuePostfix(parsePrimary(), true);

        MutableList<Stage> stages = Lists.mutable.empty();
        while (acceptSymbol(".")) {
            stages.add(parseStage());
        }

        acceptSymbol(";");
        expectEnd();
        return new StageSequence(target, source, stages.toImmutable());
    }

    private String parseTarget() {
        Token first = peek();
        boolean declared = first.isWord("const") || first.isWord("let") || first.isWord("var");
        if (declared) {
            advance();
        }
        if (peek().type() == Token.Type.IDENT && peek(1).isSymbol("=")) {
            String target = expectIdentifier();
            expectSymbol("=");
            return target;
        }
        if (declared) {
            throw error("expected a variable declaration");
        }
        return null;
    }

    private Stage parseStage() {
        Token method = peek();
        if (method.type() != Token.Type.IDENT) {
            throw error("expected a stage method name");
        }
        if (!method.isWord("filter") && !method.isWord("map")) {
            throw error("unknown stage method '" + method.text() + "', expected filter or map");
        }
        advance();
        expectSymbol("(");

        String parameter;
        if (acceptSymbol("(")) {
            parameter = expectIdentifier();
            expectSymbol(")");
        } else {
            parameter = expectIdentifier();
        }
        expectSymbol("=>");
        if (peek().isSymbol("{")) {
            throw error("block bodies are not supported, wrap object literals in parentheses");
        }

        Expr body = parseExpression();
        expectSymbol(")");

        return method.isWord("filter")
                ? new Stage.Filter(parameter, body)
                : new Stage.Map(parameter, body);
    }

    /** {@code .filter(} and {@code .map(} on the source spine start the stage list. */
    @Override
    protected boolean isStageAhead() {
        Token name = peek(1);
        return (name.isWord("filter") || name.isWord("map")) && peek(2).isSymbol("(");
    }
}
