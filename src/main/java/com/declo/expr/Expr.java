package com.declo.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Scalar expression tree shared by the chain and comprehension surfaces.
 * Equality is structural.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitInt(IntLiteral literal);
        R visitFloat(FloatLiteral literal);
        R visitString(StringLiteral literal);
        R visitBool(BoolLiteral literal);
        R visitNull(NullLiteral literal);
        R visitIdentifier(Identifier identifier);
        R visitUnary(Unary unary);
        R visitBinary(Binary binary);
        R visitCall(Call call);
        R visitAttribute(Attribute attribute);
        R visitIndex(Index index);
        R visitList(ListLiteral list);
        R visitMap(MapLiteral map);
    }

    record IntLiteral(long value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    record FloatLiteral(double value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    record StringLiteral(String value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record BoolLiteral(boolean value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record NullLiteral() implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record Identifier(String name) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record Unary(UnaryOperator operator, Expr operand) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Binary(BinaryOperator operator, Expr left, Expr right) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Call(Expr callee, ImmutableList<Expr> arguments) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Attribute(Expr target, String name) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    record Index(Expr target, Expr index) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    record ListLiteral(ImmutableList<Expr> elements) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record MapLiteral(ImmutableList<Entry> entries) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMap(this);
        }
    }

    record Entry(Expr key, Expr value) {}

    // Factories used by the parsers and tests

    static Identifier id(String name) {
        return new Identifier(name);
    }

    static IntLiteral of(long value) {
        return new IntLiteral(value);
    }

    static Binary binary(BinaryOperator operator, Expr left, Expr right) {
        return new Binary(operator, left, right);
    }

    static Call call(Expr callee, Expr... arguments) {
        return new Call(callee, Lists.immutable.of(arguments));
    }
}
