package com.declo.expr;

/**
 * Rebuilds a tree bottom-up. Subclasses override the variants they rewrite;
 * every other node is copied with its rewritten children.
 */
public abstract class ExprRewriter implements Expr.Visitor<Expr> {

    public Expr rewrite(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Expr visitInt(Expr.IntLiteral literal) {
        return literal;
    }

    @Override
    public Expr visitFloat(Expr.FloatLiteral literal) {
        return literal;
    }

    @Override
    public Expr visitString(Expr.StringLiteral literal) {
        return literal;
    }

    @Override
    public Expr visitBool(Expr.BoolLiteral literal) {
        return literal;
    }

    @Override
    public Expr visitNull(Expr.NullLiteral literal) {
        return literal;
    }

    @Override
    public Expr visitIdentifier(Expr.Identifier identifier) {
        return identifier;
    }

    @Override
    public Expr visitUnary(Expr.Unary unary) {
        return new Expr.Unary(unary.operator(), rewrite(unary.operand()));
    }

    @Override
    public Expr visitBinary(Expr.Binary binary) {
        return new Expr.Binary(binary.operator(), rewrite(binary.left()), rewrite(binary.right()));
    }

    @Override
    public Expr visitCall(Expr.Call call) {
        return new Expr.Call(rewrite(call.callee()), call.arguments().collect(this::rewrite));
    }

    @Override
    public Expr visitAttribute(Expr.Attribute attribute) {
        return new Expr.Attribute(rewrite(attribute.target()), attribute.name());
    }

    @Override
    public Expr visitIndex(Expr.Index index) {
        return new Expr.Index(rewrite(index.target()), rewrite(index.index()));
    }

    @Override
    public Expr visitList(Expr.ListLiteral list) {
        return new Expr.ListLiteral(list.elements().collect(this::rewrite));
    }

    @Override
    public Expr visitMap(Expr.MapLiteral map) {
        return new Expr.MapLiteral(map.entries().collect(
                entry -> new Expr.Entry(rewrite(entry.key()), rewrite(entry.value()))));
    }
}
