package com.declo.output;

import com.declo.comprehension.Comprehension;
import com.declo.expr.Expr;
import com.declo.syntax.Dialect;

/**
 * Renders a comprehension as {@code target = [output for x in source if c1 if c2]}.
 * Each clause keeps its own {@code if}.
 */
public class ComprehensionRenderer {
    private final ExpressionRenderer expressions = new ExpressionRenderer(Dialect.COMPREHENSION);

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public String render(Comprehension comprehension) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (comprehension.target() != null) {
            sb.append(comprehension.target()).append(" = ");
        }
        sb.append('[');
        expressions.write(comprehension.output(), 0, sb);
        sb.append(" for ").append(comprehension.variable()).append(" in ");
        expressions.write(comprehension.source(), 0, sb);
        for (Expr clause : comprehension.clauses()) {
            sb.append(" if ");
            expressions.write(clause, 0, sb);
        }
        sb.append(']');

        return sb.toString();
    }

    public String render(Expr expr) {
        return expressions.render(expr);
    }
}
