package com.declo.output;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.expr.Expr;
import com.declo.syntax.Dialect;

/**
 * Renders a stage sequence as {@code target = source.filter(x => ...).map(x => ...)}.
 */
public class ChainRenderer {
    private final ExpressionRenderer expressions = new ExpressionRenderer(Dialect.CHAIN);

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public String render(StageSequence sequence) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (sequence.target() != null) {
            sb.append(sequence.target()).append(" = ");
        }
        writeSource(sequence.source(), sb);

        for (Stage stage : sequence.stages()) {
            sb.append('.')
              .append(stage.method())
              .append('(')
              .append(stage.parameter())
              .append(" => ");
            // A bare "{" after "=>" would open a block body
            if (stage.body() instanceof Expr.MapLiteral) {
                sb.append('(');
                expressions.write(stage.body(), 0, sb);
                sb.append(')');
            } else {
                expressions.write(stage.body(), 0, sb);
            }
            sb.append(')');
        }

        return sb.toString();
    }

    public String render(Expr expr) {
        return expressions.render(expr);
    }

    private void writeSource(Expr source, StringBuilder sb) {
        if (callsStageMethod(source)) {
            sb.append('(');
            expressions.write(source, 0, sb);
            sb.append(')');
        } else {
            expressions.writeReceiver(source, sb);
        }
    }

    /**
     * True when the postfix spine of the source contains a {@code .filter(...)}
     * or {@code .map(...)} call, which would be read back as a stage.
     */
    private static boolean callsStageMethod(Expr expr) {
        if (expr instanceof Expr.Call call) {
            if (call.callee() instanceof Expr.Attribute attribute
                    && (attribute.name().equals("filter") || attribute.name().equals("map"))) {
                return true;
            }
            return callsStageMethod(call.callee());
        }
        if (expr instanceof Expr.Attribute attribute) {
            return callsStageMethod(attribute.target());
        }
        if (expr instanceof Expr.Index index) {
            return callsStageMethod(index.target());
        }
        return false;
    }
}
