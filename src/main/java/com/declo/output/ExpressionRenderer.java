package com.declo.output;

import com.declo.expr.BinaryOperator;
import com.declo.expr.Expr;
import com.declo.expr.UnaryOperator;
import com.declo.syntax.Dialect;

/**
 * Prints expressions in one dialect with canonical spacing and only the
 * parentheses that precedence requires.
 */
public class ExpressionRenderer {
    private final Dialect dialect;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(256));

    public ExpressionRenderer(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect dialect() {
        return dialect;
    }

    public String render(Expr expr) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        write(expr, 0, sb);
        return sb.toString();
    }

    /**
     * Appends {@code expr}, parenthesised when it binds looser than
     * {@code minLevel}.
     */
    public void write(Expr expr, int minLevel, StringBuilder sb) {
        if (level(expr) < minLevel) {
            sb.append('(');
            expr.accept(new Writer(sb));
            sb.append(')');
        } else {
            expr.accept(new Writer(sb));
        }
    }

    public int level(Expr expr) {
        if (expr instanceof Expr.Binary binary) {
            return dialect.precedence(binary.operator());
        }
        if (expr instanceof Expr.Unary unary) {
            return dialect.precedence(unary.operator());
        }
        if (expr instanceof Expr.Call || expr instanceof Expr.Attribute || expr instanceof Expr.Index) {
            return Dialect.LEVEL_POSTFIX;
        }
        return Dialect.LEVEL_ATOM;
    }

    /** Numeric literals need parentheses before a member access ({@code (1).x}). */
    static boolean isNumeric(Expr expr) {
        return expr instanceof Expr.IntLiteral || expr instanceof Expr.FloatLiteral;
    }

    void writeReceiver(Expr target, StringBuilder sb) {
        if (isNumeric(target)) {
            sb.append('(');
            write(target, 0, sb);
            sb.append(')');
        } else {
            write(target, Dialect.LEVEL_POSTFIX, sb);
        }
    }

    String quote(String value) {
        char quote = dialect.quote();
        StringBuilder result = new StringBuilder(value.length() + 2);
        result.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case '\b' -> result.append("\\b");
                case '\f' -> result.append("\\f");
                default -> {
                    if (c == quote) {
                        result.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7F) {
                        // \x00 rather than \0, which a following digit would turn into an octal escape
                        result.append(String.format("\\x%02x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.append(quote).toString();
    }

    private final class Writer implements Expr.Visitor<Void> {
        private final StringBuilder sb;

        Writer(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitInt(Expr.IntLiteral literal) {
            sb.append(literal.value());
            return null;
        }

        @Override
        public Void visitFloat(Expr.FloatLiteral literal) {
            sb.append(literal.value());
            return null;
        }

        @Override
        public Void visitString(Expr.StringLiteral literal) {
            sb.append(quote(literal.value()));
            return null;
        }

        @Override
        public Void visitBool(Expr.BoolLiteral literal) {
            sb.append(literal.value() ? dialect.trueWord() : dialect.falseWord());
            return null;
        }

        @Override
        public Void visitNull(Expr.NullLiteral literal) {
            sb.append(dialect.nullWord());
            return null;
        }

        @Override
        public Void visitIdentifier(Expr.Identifier identifier) {
            sb.append(identifier.name());
            return null;
        }

        @Override
        public Void visitUnary(Expr.Unary unary) {
            sb.append(dialect.spelling(unary.operator()));
            Expr operand = unary.operand();
            // "--x" would lex as a decrement in the chain surface
            if (unary.operator() == UnaryOperator.NEG
                    && operand instanceof Expr.Unary inner && inner.operator() == UnaryOperator.NEG) {
                sb.append('(');
                write(operand, 0, sb);
                sb.append(')');
            } else {
                write(operand, dialect.precedence(unary.operator()), sb);
            }
            return null;
        }

        @Override
        public Void visitBinary(Expr.Binary binary) {
            BinaryOperator operator = binary.operator();
            int level = dialect.precedence(operator);
            int leftLevel;
            int rightLevel;
            if (operator == BinaryOperator.POW) {
                leftLevel = Dialect.LEVEL_POSTFIX;
                rightLevel = dialect.powerRightLevel();
            } else if (operator.isComparison()) {
                leftLevel = level + 1;
                rightLevel = level + 1;
            } else {
                leftLevel = level;
                rightLevel = level + 1;
            }
            write(binary.left(), leftLevel, sb);
            sb.append(' ').append(dialect.spelling(operator)).append(' ');
            write(binary.right(), rightLevel, sb);
            return null;
        }

        @Override
        public Void visitCall(Expr.Call call) {
            write(call.callee(), Dialect.LEVEL_POSTFIX, sb);
            sb.append('(');
            writeAll(call.arguments());
            sb.append(')');
            return null;
        }

        @Override
        public Void visitAttribute(Expr.Attribute attribute) {
            writeReceiver(attribute.target(), sb);
            sb.append('.').append(attribute.name());
            return null;
        }

        @Override
        public Void visitIndex(Expr.Index index) {
            write(index.target(), Dialect.LEVEL_POSTFIX, sb);
            sb.append('[');
            write(index.index(), 0, sb);
            sb.append(']');
            return null;
        }

        @Override
        public Void visitList(Expr.ListLiteral list) {
            sb.append('[');
            writeAll(list.elements());
            sb.append(']');
            return null;
        }

        @Override
        public Void visitMap(Expr.MapLiteral map) {
            sb.append('{');
            boolean first = true;
            for (Expr.Entry entry : map.entries()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                writeKey(entry.key());
                sb.append(": ");
                write(entry.value(), 0, sb);
            }
            sb.append('}');
            return null;
        }

        private void writeKey(Expr key) {
            if (dialect == Dialect.COMPREHENSION
                    || key instanceof Expr.StringLiteral || isNumeric(key)) {
                write(key, 0, sb);
            } else {
                sb.append('[');
                write(key, 0, sb);
                sb.append(']');
            }
        }

        private void writeAll(Iterable<Expr> expressions) {
            boolean first = true;
            for (Expr expr : expressions) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                write(expr, 0, sb);
            }
        }
    }
}
