package com.declo.expr;

public enum UnaryOperator {
    NEG,
    NOT
}
