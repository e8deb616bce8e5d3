package com.declo.chain;

import com.declo.expr.Expr;

/**
 * One {@code filter} or {@code map} step of a chain. The parameter is local
 * to the stage.
 */
public sealed interface Stage {

    String parameter();

    Expr body();

    /** Method name in the chain surface. */
    String method();

    record Filter(String parameter, Expr body) implements Stage {
        @Override
        public String method() {
            return "filter";
        }
    }

    record Map(String parameter, Expr body) implements Stage {
        @Override
        public String method() {
            return "map";
        }
    }
}
