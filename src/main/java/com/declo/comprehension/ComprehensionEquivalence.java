package com.declo.comprehension;

import com.declo.expr.BinaryOperator;
import com.declo.expr.Expr;
import com.declo.expr.FreeIdentifiers;
import com.declo.expr.Substitution;
import com.declo.output.ExpressionRenderer;
import com.declo.syntax.Dialect;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Objects;
import java.util.Optional;

/**
 * Structural comparison of comprehensions up to renaming of the bound
 * variable, with {@code a and b} clauses treated as the two clauses
 * {@code if a if b}.
 */
public final class ComprehensionEquivalence {
    private static final ExpressionRenderer RENDERER = new ExpressionRenderer(Dialect.COMPREHENSION);

    private ComprehensionEquivalence() {
    }

    public static boolean equivalent(Comprehension expected, Comprehension actual) {
        return difference(expected, actual).isEmpty();
    }

    /**
     * Describes the first place where {@code actual} diverges from
     * {@code expected}, or empty when they are equivalent.
     */
    public static Optional<String> difference(Comprehension expected, Comprehension actual) {
        if (expected.target() != null && actual.target() != null
                && !expected.target().equals(actual.target())) {
            return Optional.of("target: expected '" + expected.target() + "' but was '" + actual.target() + "'");
        }
        if (!expected.source().equals(actual.source())) {
            return mismatch("source", expected.source(), actual.source());
        }

        ImmutableList<Expr> expectedClauses = conjuncts(expected.clauses());
        ImmutableList<Expr> actualClauses = conjuncts(actual.clauses());
        if (expectedClauses.size() != actualClauses.size()) {
            return Optional.of("clause count: expected " + expectedClauses.size()
                    + " but was " + actualClauses.size()
                    + " (expected " + render(expectedClauses) + ", was " + render(actualClauses) + ")");
        }

        String canonical = canonicalName(expected, actual);
        Expr expectedName = new Expr.Identifier(canonical);
        for (int i = 0; i < expectedClauses.size(); i++) {
            Expr left = Substitution.apply(expectedClauses.get(i), expected.variable(), expectedName);
            Expr right = Substitution.apply(actualClauses.get(i), actual.variable(), expectedName);
            if (!left.equals(right)) {
                return mismatch("clause " + (i + 1), expectedClauses.get(i), actualClauses.get(i));
            }
        }

        Expr left = Substitution.apply(expected.output(), expected.variable(), expectedName);
        Expr right = Substitution.apply(actual.output(), actual.variable(), expectedName);
        if (!Objects.equals(left, right)) {
            return mismatch("output", expected.output(), actual.output());
        }
        return Optional.empty();
    }

    /** Flattens top-level {@code and} chains into separate clauses, preserving order. */
    public static ImmutableList<Expr> conjuncts(ImmutableList<Expr> clauses) {
        MutableList<Expr> flat = Lists.mutable.empty();
        clauses.forEach(clause -> flatten(clause, flat));
        return flat.toImmutable();
    }

    private static void flatten(Expr clause, MutableList<Expr> into) {
        if (clause instanceof Expr.Binary binary && binary.operator() == BinaryOperator.AND) {
            flatten(binary.left(), into);
            flatten(binary.right(), into);
        } else {
            into.add(clause);
        }
    }

    /** A name free in neither comprehension, so renaming cannot capture. */
    private static String canonicalName(Comprehension first, Comprehension second) {
        MutableSet<String> used = Sets.mutable.empty();
        for (Comprehension c : Lists.immutable.of(first, second)) {
            c.clauses().forEach(clause -> used.addAll(FreeIdentifiers.of(clause)));
            used.addAll(FreeIdentifiers.of(c.output()));
        }
        String name = "_v";
        for (int suffix = 1; used.contains(name); suffix++) {
            name = "_v" + suffix;
        }
        return name;
    }

    private static Optional<String> mismatch(String where, Expr expected, Expr actual) {
        return Optional.of(where + ": expected `" + RENDERER.render(expected)
                + "` but was `" + RENDERER.render(actual) + "`");
    }

    private static String render(ImmutableList<Expr> clauses) {
        return clauses.collect(RENDERER::render).makeString("[", ", ", "]");
    }
}
