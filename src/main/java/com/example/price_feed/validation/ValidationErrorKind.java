package com.example.price_feed.validation;

/**
 * Reasons a set-price request is rejected as malformed, in the order they are checked.
 */
public enum ValidationErrorKind {
    MISSING_SYMBOL("symbol is required"),
    MISSING_AMOUNT("amount is required"),
    NON_NUMERIC_AMOUNT("amount must be numeric"),
    NON_POSITIVE_AMOUNT("amount must be greater than zero"),
    AMOUNT_OUT_OF_RANGE("amount is too large"),
    MISSING_TYPE("type is required"),
    UNSUPPORTED_TYPE("unsupported currency type");

    private final String message;

    ValidationErrorKind(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
