package com.declo.expr;

/**
 * Replaces every {@link Expr.Identifier} with the given name by a replacement
 * expression. Attribute names are not identifiers and are left alone.
 */
public final class Substitution extends ExprRewriter {
    private final String name;
    private final Expr replacement;

    private Substitution(String name, Expr replacement) {
        this.name = name;
        this.replacement = replacement;
    }

    public static Expr apply(Expr expr, String name, Expr replacement) {
        return new Substitution(name, replacement).rewrite(expr);
    }

    @Override
    public Expr visitIdentifier(Expr.Identifier identifier) {
        return identifier.name().equals(name) ? replacement : identifier;
    }
}
