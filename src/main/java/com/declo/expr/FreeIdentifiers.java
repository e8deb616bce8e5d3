package com.declo.expr;

import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Collects identifier names referenced by an expression. The subset grammar
 * has no binders inside expressions, so every identifier is free.
 */
public final class FreeIdentifiers implements Expr.Visitor<Void> {
    private final MutableSet<String> names = Sets.mutable.empty();

    private FreeIdentifiers() {
    }

    public static MutableSet<String> of(Expr expr) {
        FreeIdentifiers collector = new FreeIdentifiers();
        expr.accept(collector);
        return collector.names;
    }

    public static boolean occursIn(String name, Expr expr) {
        return of(expr).contains(name);
    }

    @Override
    public Void visitInt(Expr.IntLiteral literal) {
        return null;
    }

    @Override
    public Void visitFloat(Expr.FloatLiteral literal) {
        return null;
    }

    @Override
    public Void visitString(Expr.StringLiteral literal) {
        return null;
    }

    @Override
    public Void visitBool(Expr.BoolLiteral literal) {
        return null;
    }

    @Override
    public Void visitNull(Expr.NullLiteral literal) {
        return null;
    }

    @Override
    public Void visitIdentifier(Expr.Identifier identifier) {
        names.add(identifier.name());
        return null;
    }

    @Override
    public Void visitUnary(Expr.Unary unary) {
        return unary.operand().accept(this);
    }

    @Override
    public Void visitBinary(Expr.Binary binary) {
        binary.left().accept(this);
        return binary.right().accept(this);
    }

    @Override
    public Void visitCall(Expr.Call call) {
        call.callee().accept(this);
        call.arguments().forEach(argument -> argument.accept(this));
        return null;
    }

    @Override
    public Void visitAttribute(Expr.Attribute attribute) {
        return attribute.target().accept(this);
    }

    @Override
    public Void visitIndex(Expr.Index index) {
        index.target().accept(this);
        return index.index().accept(this);
    }

    @Override
    public Void visitList(Expr.ListLiteral list) {
        list.elements().forEach(element -> element.accept(this));
        return null;
    }

    @Override
    public Void visitMap(Expr.MapLiteral map) {
        map.entries().forEach(entry -> {
            entry.key().accept(this);
            entry.value().accept(this);
        });
        return null;
    }
}
