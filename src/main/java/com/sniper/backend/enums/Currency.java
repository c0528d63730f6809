package com.sniper.backend.enums;

public enum Currency {
    BRL("R$"),
    USD("US$");

    private final String symbol;

    Currency(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
