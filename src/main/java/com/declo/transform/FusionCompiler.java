package com.declo.transform;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.comprehension.Comprehension;
import com.declo.expr.Expr;
import com.declo.expr.FreeIdentifiers;
import com.declo.expr.Substitution;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Fuses a chain into one comprehension. Stages are folded left to right over
 * a running value expression: a map replaces the value, a filter appends a
 * clause tested against the current value.
 */
public class FusionCompiler {
    static final String DEFAULT_VARIABLE = "x";

    public Comprehension fuse(StageSequence sequence) {
        String variable = boundVariable(sequence.stages());

        Fold fold = new Fold(new Expr.Identifier(variable), Lists.immutable.empty());
        for (Stage stage : sequence.stages()) {
            fold = fold.apply(stage);
        }

        return new Comprehension(sequence.target(), variable, sequence.source(), fold.clauses(), fold.value());
    }

    /**
     * The first stage's parameter, unless a later stage with a different
     * parameter reads an outer variable of that name, which would be captured.
     */
    String boundVariable(ImmutableList<Stage> stages) {
        if (stages.isEmpty()) {
            return DEFAULT_VARIABLE;
        }
        String candidate = stages.getFirst().parameter();
        if (isFreeIn(candidate, stages)) {
            return freshName(candidate, stages);
        }
        return candidate;
    }

    private static boolean isFreeIn(String name, ImmutableList<Stage> stages) {
        return stages.anySatisfy(stage -> !stage.parameter().equals(name)
                && FreeIdentifiers.occursIn(name, stage.body()));
    }

    private static String freshName(String base, ImmutableList<Stage> stages) {
        for (int suffix = 1; ; suffix++) {
            String name = base + suffix;
            boolean used = stages.anySatisfy(stage -> stage.parameter().equals(name)
                    || FreeIdentifiers.occursIn(name, stage.body()));
            if (!used) {
                return name;
            }
        }
    }

    /** Accumulator threaded through the stage fold. */
    private record Fold(Expr value, ImmutableList<Expr> clauses) {

        Fold apply(Stage stage) {
            Expr body = Substitution.apply(stage.body(), stage.parameter(), value);
            if (stage instanceof Stage.Filter) {
                return new Fold(value, clauses.newWith(body));
            }
            return new Fold(body, clauses);
        }
    }
}
