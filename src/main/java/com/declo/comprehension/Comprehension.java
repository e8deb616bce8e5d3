package com.declo.comprehension;

import com.declo.expr.Expr;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A single-generator list comprehension: {@code [output for variable in source if c1 if c2]}.
 * Clauses are conjoined left to right.
 *
 * @param target assignment target, or null for a bare comprehension
 */
public record Comprehension(String target, String variable, Expr source,
                            ImmutableList<Expr> clauses, Expr output) {

    public boolean isIdentityOutput() {
        return output instanceof Expr.Identifier identifier && identifier.name().equals(variable);
    }
}
