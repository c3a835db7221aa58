package org.shadelang.frontend.astnode;

public enum UnaryOperator {
    NEG("-"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
