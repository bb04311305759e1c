package com.example.price_feed.validation;

/**
 * Thrown for a well-formed request naming a symbol that is not registered.
 */
public class UnknownSymbolException extends RuntimeException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Unknown symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
