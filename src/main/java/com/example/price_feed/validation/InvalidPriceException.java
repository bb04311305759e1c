package com.example.price_feed.validation;

public class InvalidPriceException extends RuntimeException {

    private final ValidationErrorKind kind;

    public InvalidPriceException(ValidationErrorKind kind) {
        this(kind, kind.getMessage());
    }

    public InvalidPriceException(ValidationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationErrorKind getKind() {
        return kind;
    }
}
