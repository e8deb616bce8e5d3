package com.declo.transform;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.comprehension.Comprehension;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits a comprehension back into a chain: one filter per clause in order,
 * then a single map unless the output is the bound variable itself.
 * <p>
 * The original interleaving of filters and maps is not recoverable, so the
 * result is canonical rather than authorial. Re-fusing it reproduces the
 * input comprehension.
 */
public class DefusionDecompiler {

    public StageSequence defuse(Comprehension comprehension) {
        String variable = comprehension.variable();
        MutableList<Stage> stages = Lists.mutable.empty();

        comprehension.clauses().forEach(clause -> stages.add(new Stage.Filter(variable, clause)));
        if (!comprehension.isIdentityOutput()) {
            stages.add(new Stage.Map(variable, comprehension.output()));
        }

        return new StageSequence(comprehension.target(), comprehension.source(), stages.toImmutable());
    }
}
