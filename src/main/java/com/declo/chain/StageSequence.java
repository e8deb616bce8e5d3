package com.declo.chain;

import com.declo.expr.Expr;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A source expression followed by stages in the order the author wrote them.
 *
 * @param target assignment target, or null for a bare chain
 */
public record StageSequence(String target, Expr source, ImmutableList<Stage> stages) {

    public int filterCount() {
        return stages.count(stage -> stage instanceof Stage.Filter);
    }
}
