package com.declo.transform;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.comprehension.Comprehension;
import com.declo.comprehension.ComprehensionEquivalence;
import com.declo.harness.CorpusExample;
import com.declo.harness.CorpusLoader;
import com.declo.output.ChainRenderer;
import com.declo.syntax.ComprehensionParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.declo.expr.Expr.id;
import static org.junit.jupiter.api.Assertions.*;

public class DefusionDecompilerTest {

    private final DefusionDecompiler decompiler = new DefusionDecompiler();
    private final FusionCompiler compiler = new FusionCompiler();
    private final ComprehensionParser comprehensions = new ComprehensionParser();
    private final ChainRenderer renderer = new ChainRenderer();

    @Test
    public void testFilterThenMap() {
        StageSequence sequence = decompiler.defuse(comprehensions.parse("[x * x for x in nums if x % 2 == 0]"));

        assertEquals(2, sequence.stages().size());
        assertTrue(sequence.stages().get(0) instanceof Stage.Filter);
        assertTrue(sequence.stages().get(1) instanceof Stage.Map);
        assertEquals("nums.filter(x => x % 2 == 0).map(x => x * x)", renderer.render(sequence));
    }

    @Test
    public void testIdentityOutputDropsMap() {
        StageSequence sequence = decompiler.defuse(comprehensions.parse("evens = [n for n in nums if n % 2 == 0]"));
        assertEquals("evens = nums.filter(n => n % 2 == 0)", renderer.render(sequence));
    }

    @Test
    public void testNoClausesAndIdentityOutputGivesBareSource() {
        StageSequence sequence = decompiler.defuse(comprehensions.parse("[v for v in values]"));
        assertTrue(sequence.stages().isEmpty());
        assertEquals(id("values"), sequence.source());
        assertEquals("values", renderer.render(sequence));
    }

    @Test
    public void testBareSourceRefusesWithDefaultVariable() {
        // No stage is left to carry the name "y", so fusion falls back to "x"
        Comprehension original = comprehensions.parse("[y for y in xs]");
        Comprehension refused = compiler.fuse(decompiler.defuse(original));

        assertEquals("x", refused.variable());
        assertNotEquals(original, refused);
        assertTrue(ComprehensionEquivalence.equivalent(original, refused));
        assertEquals(original, new Comprehension(refused.target(), "y", refused.source(), refused.clauses(), id("y")));
    }

    @Test
    public void testEveryClauseBecomesOneFilter() {
        StageSequence sequence = decompiler.defuse(
                comprehensions.parse("[p.name for p in people if p.age > 18 if p.active if p.name != '']"));

        assertEquals(3, sequence.filterCount());
        assertEquals(4, sequence.stages().size());
        assertTrue(sequence.stages().allSatisfy(stage -> stage.parameter().equals("p")));
    }

    @Test
    public void testMapLiteralOutputIsParenthesised() {
        StageSequence sequence = decompiler.defuse(comprehensions.parse("[{'id': r.id} for r in rows]"));
        assertEquals("rows.map(r => ({\"id\": r.id}))", renderer.render(sequence));
    }

    @Test
    public void testFuseAfterDefuseReproducesCorpus() throws IOException {
        for (CorpusExample example : new CorpusLoader().loadDefault()) {
            Comprehension original = comprehensions.parse(example.comprehension());
            StageSequence sequence = decompiler.defuse(original);

            assertTrue(sequence.stages().size() <= original.clauses().size() + 1, example.title());
            Comprehension refused = compiler.fuse(sequence);
            assertTrue(ComprehensionEquivalence.equivalent(original, refused), example.title());
            assertEquals(original.clauses(), refused.clauses(), example.title());
        }
    }
}
