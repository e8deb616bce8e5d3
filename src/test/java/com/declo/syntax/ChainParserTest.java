package com.declo.syntax;

import com.declo.chain.Stage;
import com.declo.chain.StageSequence;
import com.declo.expr.BinaryOperator;
import com.declo.expr.Expr;
import com.declo.expr.UnaryOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.declo.expr.Expr.binary;
import static com.declo.expr.Expr.id;
import static com.declo.expr.Expr.of;
import static org.junit.jupiter.api.Assertions.*;

public class ChainParserTest {

    private final ChainParser parser = new ChainParser();

    @Test
    public void testSingleFilter() {
        StageSequence sequence = parser.parse("nums.filter(x => x % 2 == 0)");

        assertNull(sequence.target());
        assertEquals(id("nums"), sequence.source());
        assertEquals(1, sequence.stages().size());
        Stage stage = sequence.stages().get(0);
        assertTrue(stage instanceof Stage.Filter);
        assertEquals("x", stage.parameter());
        assertEquals(binary(BinaryOperator.EQ, binary(BinaryOperator.MOD, id("x"), of(2)), of(0)), stage.body());
    }

    @Test
    public void testStagesKeepTextualOrder() {
        StageSequence sequence = parser.parse("nums.filter(x => x > 2).map(x => x * x).filter(x => x < 20)");

        assertEquals(3, sequence.stages().size());
        assertTrue(sequence.stages().get(0) instanceof Stage.Filter);
        assertTrue(sequence.stages().get(1) instanceof Stage.Map);
        assertTrue(sequence.stages().get(2) instanceof Stage.Filter);
        assertEquals(2, sequence.filterCount());
    }

    @Test
    public void testAssignmentTargetAndDeclaration() {
        StageSequence plain = parser.parse("result = nums.map(x => x + 1)");
        StageSequence declared = parser.parse("const result = nums.map(x => x + 1);");

        assertEquals("result", plain.target());
        assertEquals(plain, declared);
    }

    @Test
    public void testBareSourceHasNoStages() {
        StageSequence sequence = parser.parse("nums");
        assertEquals(id("nums"), sequence.source());
        assertTrue(sequence.stages().isEmpty());
    }

    @Test
    public void testParameterNamesMayDifferPerStage() {
        StageSequence sequence = parser.parse("users.filter(u => u.active).map((user) => user.name)");

        assertEquals("u", sequence.stages().get(0).parameter());
        assertEquals("user", sequence.stages().get(1).parameter());
        assertEquals(new Expr.Attribute(id("user"), "name"), sequence.stages().get(1).body());
    }

    @Test
    public void testAttributeSourceStopsAtFirstStage() {
        StageSequence sequence = parser.parse("order.items.filter(i => i.qty > 0)");
        assertEquals(new Expr.Attribute(id("order"), "items"), sequence.source());
    }

    @Test
    public void testFilterAttributeWithoutCallBelongsToSource() {
        StageSequence sequence = parser.parse("config.filter.map(x => x)");
        assertEquals(new Expr.Attribute(id("config"), "filter"), sequence.source());
        assertEquals(1, sequence.stages().size());
    }

    @Test
    public void testParenthesisedSourceMayContainStageCalls() {
        StageSequence sequence = parser.parse("(repo.filter(1)).map(x => x)");
        assertEquals(Expr.call(new Expr.Attribute(id("repo"), "filter"), of(1)), sequence.source());
        assertEquals(1, sequence.stages().size());
    }

    @Test
    public void testJavaScriptSpellings() {
        StageSequence sequence = parser.parse(
                "xs.filter(x => !x.done && (x.tag === \"a\" || x.tag !== null))");
        Expr body = sequence.stages().get(0).body();

        Expr expected = binary(BinaryOperator.AND,
                new Expr.Unary(UnaryOperator.NOT, new Expr.Attribute(id("x"), "done")),
                binary(BinaryOperator.OR,
                        binary(BinaryOperator.EQ, new Expr.Attribute(id("x"), "tag"), new Expr.StringLiteral("a")),
                        binary(BinaryOperator.NE, new Expr.Attribute(id("x"), "tag"), new Expr.NullLiteral())));
        assertEquals(expected, body);
    }

    @Test
    public void testObjectLiteralBody() {
        StageSequence sequence = parser.parse("rows.map(r => ({id: r.id, \"n\": 1, [r.key]: true}))");
        Expr.MapLiteral map = (Expr.MapLiteral) sequence.stages().get(0).body();

        assertEquals(3, map.entries().size());
        assertEquals(new Expr.StringLiteral("id"), map.entries().get(0).key());
        assertEquals(new Expr.StringLiteral("n"), map.entries().get(1).key());
        assertEquals(new Expr.Attribute(id("r"), "key"), map.entries().get(2).key());
        assertEquals(new Expr.BoolLiteral(true), map.entries().get(2).value());
    }

    @Test
    public void testPowerIsRightAssociative() {
        Expr body = parser.parse("xs.map(x => 2 ** x ** 2)").stages().get(0).body();
        assertEquals(binary(BinaryOperator.POW, of(2), binary(BinaryOperator.POW, id("x"), of(2))), body);
    }

    @Test
    public void testLiterals() {
        Expr body = parser.parse("xs.map(x => [1, 2.5, 'single', \"double\\n\", false, null])").stages().get(0).body();
        Expr.ListLiteral list = (Expr.ListLiteral) body;

        assertEquals(of(1), list.elements().get(0));
        assertEquals(new Expr.FloatLiteral(2.5), list.elements().get(1));
        assertEquals(new Expr.StringLiteral("single"), list.elements().get(2));
        assertEquals(new Expr.StringLiteral("double\n"), list.elements().get(3));
        assertEquals(new Expr.BoolLiteral(false), list.elements().get(4));
        assertEquals(new Expr.NullLiteral(), list.elements().get(5));
    }

    @Test
    public void testCommentsAreIgnored() {
        StageSequence sequence = parser.parse("nums /* source */\n  .map(x => x + 1) // bump");
        assertEquals(1, sequence.stages().size());
    }

    // ============================================================
    // Syntax errors
    // ============================================================

    @Test
    public void testUnknownStageMethod() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("nums.filter(x => x > 1).reduce(x => x)"));
        assertEquals("reduce", e.getNear());
        assertTrue(e.getReason().contains("unknown stage method"));
        assertEquals(24, e.getOffset());
    }

    @Test
    public void testMemberAfterStagesIsRejected() {
        assertThrows(DecloSyntaxException.class, () -> parser.parse("nums.map(x => x).length"));
    }

    @Test
    public void testBlockBodyIsRejected() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("nums.map(x => { return x; })"));
        assertTrue(e.getReason().contains("block bodies"));
    }

    @Test
    public void testUnmatchedParenthesis() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("nums.map(x => (x + 1)"));
        assertEquals("expected ')'", e.getReason());
        assertTrue(e.getMessage().contains("at end of input"));
    }

    @Test
    public void testArrowOutsideStageIsRejected() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("nums.map(x => x.items.map(y => y))"));
        assertTrue(e.getReason().contains("arrow functions"));
    }

    @Test
    public void testInfiniteFloatIsRejected() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("xs.map(x => x * 1e999)"));
        assertEquals("float literal out of range", e.getReason());
        assertEquals("1e999", e.getNear());
    }

    @Test
    public void testPythonKeywordIsNotAName() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("items.filter(i => i.ok == None)"));
        assertEquals("'None' is a reserved word in Python and cannot be translated", e.getReason());
        assertThrows(DecloSyntaxException.class, () -> parser.parse("lambda = xs.map(x => x)"));
        assertThrows(DecloSyntaxException.class, () -> parser.parse("xs.map(is => is + 1)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "nums.filter(x => x > 1 ? 1 : 0)",
        "nums.filter(x => 1 < x < 3)",
        "nums.map(x => x) + 1",
        "if (x) nums",
        "nums.map(1)",
        "const nums",
        "nums.map(x => \"open)",
        "nums.map(x => x @ 2)",
        ""
    })
    public void testMalformedChains(String text) {
        assertThrows(DecloSyntaxException.class, () -> parser.parse(text));
    }

    @Test
    public void testErrorPositionOnSecondLine() {
        DecloSyntaxException e = assertThrows(DecloSyntaxException.class,
                () -> parser.parse("nums\n  .sort(x => x)"));
        assertEquals(2, e.getLine());
        assertEquals(9, e.getColumn());
        assertTrue(e.getMessage().startsWith("Syntax error at 2:9 near 'x'"));
    }
}
