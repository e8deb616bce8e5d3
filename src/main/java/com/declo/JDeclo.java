package com.declo;

import com.declo.chain.StageSequence;
import com.declo.comprehension.Comprehension;
import com.declo.harness.CorpusExample;
import com.declo.harness.CorpusLoader;
import com.declo.harness.CorpusRunner;
import com.declo.harness.Report;
import com.declo.output.ChainRenderer;
import com.declo.output.ComprehensionRenderer;
import com.declo.output.ReportFormatter;
import com.declo.syntax.ChainParser;
import com.declo.syntax.ComprehensionParser;
import com.declo.transform.DefusionDecompiler;
import com.declo.transform.FusionCompiler;
import org.eclipse.collections.api.list.ImmutableList;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "jdeclo", mixinStandardHelpOptions = true, version = "1.0",
         description = "Translate between chained filter/map code and list comprehensions",
         subcommands = {
             JDeclo.Compile.class,
             JDeclo.Decompile.class,
             JDeclo.ListExamples.class,
             JDeclo.TestExamples.class,
             JDeclo.TestAll.class
         })
public class JDeclo implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JDeclo()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    static String readInput(File inputFile) throws IOException {
        if (inputFile == null) {
            return read(System.in);
        }
        try (InputStream input = new FileInputStream(inputFile)) {
            return read(input);
        }
    }

    private static String read(InputStream input) throws IOException {
        return new String(input.readAllBytes(), StandardCharsets.UTF_8).strip();
    }

    static ImmutableList<CorpusExample> loadCorpus(File corpusFile) throws IOException {
        CorpusLoader loader = new CorpusLoader();
        if (corpusFile == null) {
            return loader.loadDefault();
        }
        try (InputStream input = new FileInputStream(corpusFile)) {
            return loader.load(input);
        }
    }

    static int fail(CommandSpec spec, Exception e) {
        spec.commandLine().getErr().println("Error: " + e.getMessage());
        return 1;
    }

    @Command(name = "compile", description = "Compile a chain into a list comprehension")
    static class Compile implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "File holding the chain (default: stdin)")
        private File inputFile;

        @Override
        public Integer call() {
            try {
                StageSequence chain = new ChainParser().parse(readInput(inputFile));
                Comprehension fused = new FusionCompiler().fuse(chain);
                spec.commandLine().getOut().println(new ComprehensionRenderer().render(fused));
                return 0;
            } catch (Exception e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "decompile", description = "Decompile a list comprehension into a chain")
    static class Decompile implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "File holding the comprehension (default: stdin)")
        private File inputFile;

        @Override
        public Integer call() {
            try {
                Comprehension comprehension = new ComprehensionParser().parse(readInput(inputFile));
                StageSequence chain = new DefusionDecompiler().defuse(comprehension);
                spec.commandLine().getOut().println(new ChainRenderer().render(chain));
                return 0;
            } catch (Exception e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "list", description = "List the examples of a corpus")
    static class ListExamples implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = "--corpus", description = "Corpus JSON file (default: bundled examples)")
        private File corpusFile;

        @Override
        public Integer call() {
            try {
                ImmutableList<CorpusExample> examples = loadCorpus(corpusFile);
                spec.commandLine().getOut().print(
                        new ReportFormatter(false).formatTitles(examples.collect(CorpusExample::title)));
                return 0;
            } catch (Exception e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "test", description = "Show compile, decompile and roundtrip results per example")
    static class TestExamples implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "1-based example id (default: all)")
        private Integer exampleId;

        @Option(names = "--corpus", description = "Corpus JSON file (default: bundled examples)")
        private File corpusFile;

        @Option(names = {"-C", "--color-output"}, description = "Colorize PASS/FAIL markers")
        private boolean colorOutput = false;

        @Override
        public Integer call() {
            try {
                ImmutableList<CorpusExample> examples = loadCorpus(corpusFile);
                PrintWriter out = spec.commandLine().getOut();
                ReportFormatter formatter = new ReportFormatter(colorOutput);
                CorpusRunner runner = new CorpusRunner();

                if (exampleId != null) {
                    if (exampleId < 1 || exampleId > examples.size()) {
                        spec.commandLine().getErr().println("Error: invalid example id " + exampleId
                                + ", expected a number between 1 and " + examples.size());
                        return 1;
                    }
                    var result = runner.check(exampleId, examples.get(exampleId - 1));
                    out.print(formatter.formatExample(result));
                    return result.allPassed() ? 0 : 1;
                }

                Report report = runner.run(examples.castToList());
                report.results().forEach(result -> out.println(formatter.formatExample(result)));
                return report.allPassed() ? 0 : 1;
            } catch (Exception e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "test-all", description = "Run every check over a corpus and print the summary")
    static class TestAll implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = "--corpus", description = "Corpus JSON file (default: bundled examples)")
        private File corpusFile;

        @Option(names = {"-p", "--parallel"}, description = "Check examples in parallel")
        private boolean parallel = false;

        @Option(names = {"-C", "--color-output"}, description = "Colorize success rates")
        private boolean colorOutput = false;

        @Override
        public Integer call() {
            try {
                ImmutableList<CorpusExample> examples = loadCorpus(corpusFile);
                Report report = new CorpusRunner(parallel).run(examples.castToList());
                spec.commandLine().getOut().print(new ReportFormatter(colorOutput).formatSummary(report));
                return report.allPassed() ? 0 : 1;
            } catch (Exception e) {
                return fail(spec, e);
            }
        }
    }
}
