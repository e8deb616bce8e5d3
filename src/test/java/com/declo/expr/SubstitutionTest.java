package com.declo.expr;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.junit.jupiter.api.Test;

import static com.declo.expr.Expr.binary;
import static com.declo.expr.Expr.id;
import static com.declo.expr.Expr.of;
import static org.junit.jupiter.api.Assertions.*;

public class SubstitutionTest {

    @Test
    public void testReplacesEveryOccurrence() {
        Expr body = binary(BinaryOperator.ADD, id("x"), binary(BinaryOperator.MUL, id("x"), of(2)));
        Expr replacement = binary(BinaryOperator.SUB, id("y"), of(1));

        Expr result = Substitution.apply(body, "x", replacement);

        assertEquals(binary(BinaryOperator.ADD, replacement, binary(BinaryOperator.MUL, replacement, of(2))), result);
    }

    @Test
    public void testAttributeNamesAreNotIdentifiers() {
        Expr body = new Expr.Attribute(id("u"), "u");
        assertEquals(new Expr.Attribute(id("user"), "u"), Substitution.apply(body, "u", id("user")));
    }

    @Test
    public void testReachesEveryContainer() {
        Expr body = new Expr.ListLiteral(Lists.immutable.of(
                Expr.call(id("f"), id("x")),
                new Expr.Index(id("m"), id("x")),
                new Expr.MapLiteral(Lists.immutable.of(new Expr.Entry(id("x"), new Expr.Unary(UnaryOperator.NEG, id("x")))))));

        Expr result = Substitution.apply(body, "x", of(7));

        assertFalse(FreeIdentifiers.occursIn("x", result));
        assertEquals(Sets.mutable.of("f", "m"), FreeIdentifiers.of(result));
    }

    @Test
    public void testUntouchedTreeIsEqual() {
        Expr body = binary(BinaryOperator.GT, new Expr.Attribute(id("p"), "age"), of(18));
        assertEquals(body, Substitution.apply(body, "q", id("z")));
    }

    @Test
    public void testFreeIdentifiersSkipLiteralsAndAttributeNames() {
        Expr expr = binary(BinaryOperator.AND,
                binary(BinaryOperator.EQ, new Expr.Attribute(id("item"), "status"), new Expr.StringLiteral("x")),
                new Expr.BoolLiteral(true));
        assertEquals(Sets.mutable.of("item"), FreeIdentifiers.of(expr));
        assertFalse(FreeIdentifiers.occursIn("status", expr));
    }
}
