package com.declo.harness;

import com.declo.chain.StageSequence;
import com.declo.comprehension.Comprehension;
import com.declo.comprehension.ComprehensionEquivalence;
import com.declo.output.ChainRenderer;
import com.declo.output.ComprehensionRenderer;
import com.declo.syntax.ChainParser;
import com.declo.syntax.ComprehensionParser;
import com.declo.syntax.DecloSyntaxException;
import com.declo.transform.DefusionDecompiler;
import com.declo.transform.FusionCompiler;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs the compilation, decompilation and roundtrip checks over a corpus.
 * A failing example is recorded and the run continues.
 */
public class CorpusRunner {
    private final FusionCompiler fusion;
    private final DefusionDecompiler defusion;
    private final boolean parallel;
    private final ChainRenderer chainRenderer = new ChainRenderer();
    private final ComprehensionRenderer comprehensionRenderer = new ComprehensionRenderer();

    public CorpusRunner() {
        this(new FusionCompiler(), new DefusionDecompiler(), false);
    }

    public CorpusRunner(boolean parallel) {
        this(new FusionCompiler(), new DefusionDecompiler(), parallel);
    }

    public CorpusRunner(FusionCompiler fusion, DefusionDecompiler defusion, boolean parallel) {
        this.fusion = fusion;
        this.defusion = defusion;
        this.parallel = parallel;
    }

    public Report run(List<CorpusExample> examples) {
        IntStream indices = IntStream.range(0, examples.size());
        if (parallel) {
            indices = indices.parallel();
        }
        // Encounter order is preserved by collect, so indices stay aligned with the corpus
        List<ExampleResult> results = indices
                .mapToObj(i -> check(i + 1, examples.get(i)))
                .collect(Collectors.toList());
        return Report.of(Lists.immutable.ofAll(results));
    }

    /** Runs all three checks on one example. Parsers are created per call, so this is thread-safe. */
    public ExampleResult check(int index, CorpusExample example) {
        MutableList<CheckResult> checks = Lists.mutable.empty();

        Comprehension expected = null;
        String expectedError = null;
        try {
            expected = new ComprehensionParser().parse(example.comprehension());
        } catch (DecloSyntaxException e) {
            expectedError = "comprehension does not parse: " + e.getMessage();
        }

        // Compilation: chain -> comprehension text, compared with the expected comprehension
        String compiled = null;
        try {
            StageSequence chain = new ChainParser().parse(example.chain());
            compiled = comprehensionRenderer.render(fusion.fuse(chain));
            if (expected == null) {
                checks.add(CheckResult.fail(Category.COMPILATION, expectedError));
            } else {
                Comprehension reparsed = new ComprehensionParser().parse(compiled);
                checks.add(compare(Category.COMPILATION, expected, reparsed));
            }
        } catch (DecloSyntaxException e) {
            String what = compiled == null ? "chain does not parse: " : "compiled text does not parse: ";
            checks.add(CheckResult.fail(Category.COMPILATION, what + e.getMessage()));
        } catch (RuntimeException e) {
            checks.add(CheckResult.fail(Category.COMPILATION, "unexpected error: " + e));
        }

        // Decompilation: comprehension -> chain text that parses back
        String decompiled = null;
        StageSequence defused = null;
        if (expected == null) {
            checks.add(CheckResult.fail(Category.DECOMPILATION, expectedError));
        } else {
            try {
                defused = defusion.defuse(expected);
                decompiled = chainRenderer.render(defused);
                new ChainParser().parse(decompiled);
                checks.add(CheckResult.pass(Category.DECOMPILATION));
            } catch (DecloSyntaxException e) {
                checks.add(CheckResult.fail(Category.DECOMPILATION,
                        "decompiled chain does not parse: " + e.getMessage()));
            } catch (RuntimeException e) {
                defused = null;
                checks.add(CheckResult.fail(Category.DECOMPILATION, "unexpected error: " + e));
            }
        }

        // Roundtrip: re-fusing the decompiled chain must give back the comprehension
        if (defused == null) {
            checks.add(CheckResult.fail(Category.ROUNDTRIP,
                    expectedError != null ? expectedError : "nothing to re-fuse"));
        } else {
            try {
                checks.add(compare(Category.ROUNDTRIP, expected, fusion.fuse(defused)));
            } catch (RuntimeException e) {
                checks.add(CheckResult.fail(Category.ROUNDTRIP, "unexpected error: " + e));
            }
        }

        return new ExampleResult(index, example.title(), compiled, decompiled, checks.toImmutable());
    }

    private static CheckResult compare(Category category, Comprehension expected, Comprehension actual) {
        Optional<String> difference = ComprehensionEquivalence.difference(expected, actual);
        return difference
                .map(reason -> CheckResult.fail(category, reason))
                .orElseGet(() -> CheckResult.pass(category));
    }
}
