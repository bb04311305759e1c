package com.example.price_feed.validation;

import com.example.price_feed.config.PriceFeedProperties;
import com.example.price_feed.model.PriceEntry;
import com.example.price_feed.model.SetPriceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a raw {@link SetPriceRequest} into a {@link PriceEntry} ready to be stored.
 * Nothing is stored on failure; the caller only sees the exception.
 */
@Component
public class PriceRequestValidator {

    private static final Logger logger = LoggerFactory.getLogger(PriceRequestValidator.class);

    // Integer digits allowed in an amount.
    static final int MAX_INTEGER_DIGITS = 30;

    private final PriceFeedProperties properties;

    public PriceRequestValidator(PriceFeedProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void logRegistry() {
        logger.info("Accepting prices for symbols {} in currencies {} (precision {})",
                properties.getSymbols(), properties.getCurrencies(), properties.getPrecision());
    }

    /**
     * Checks the request field by field; the first failing check decides the outcome.
     *
     * @throws InvalidPriceException if a field is missing, malformed or out of range
     * @throws UnknownSymbolException if every field is well-formed but the symbol is not registered
     */
    public PriceEntry validate(SetPriceRequest request) {
        if (request == null || request.symbol() == null || request.symbol().isBlank()) {
            throw new InvalidPriceException(ValidationErrorKind.MISSING_SYMBOL);
        }

        BigDecimal amount = parseAmount(request.amount());

        String type = request.type();
        if (type == null || type.isBlank()) {
            throw new InvalidPriceException(ValidationErrorKind.MISSING_TYPE);
        }
        if (!properties.isSupportedCurrency(type)) {
            throw new InvalidPriceException(ValidationErrorKind.UNSUPPORTED_TYPE,
                    "unsupported currency type: " + type);
        }

        String symbol = properties.findSymbol(request.symbol())
                .orElseThrow(() -> new UnknownSymbolException(request.symbol()));

        return new PriceEntry(symbol, amount, type);
    }

    private BigDecimal parseAmount(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidPriceException(ValidationErrorKind.MISSING_AMOUNT);
        }

        BigDecimal amount;
        if (node.isNumber()) {
            amount = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                amount = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidPriceException(ValidationErrorKind.NON_NUMERIC_AMOUNT,
                        "amount must be numeric: " + node.asText());
            }
        } else {
            throw new InvalidPriceException(ValidationErrorKind.NON_NUMERIC_AMOUNT);
        }

        if (amount.signum() <= 0) {
            throw new InvalidPriceException(ValidationErrorKind.NON_POSITIVE_AMOUNT);
        }
        // Range checks use precision and scale only: setScale on an extreme exponent runs unbounded.
        if (amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidPriceException(ValidationErrorKind.AMOUNT_OUT_OF_RANGE);
        }
        int maxScale = properties.getPrecision();
        if (amount.scale() - amount.precision() > maxScale) {
            // below half of the smallest representable unit, rounds to zero
            throw new InvalidPriceException(ValidationErrorKind.NON_POSITIVE_AMOUNT);
        }
        if (amount.scale() > maxScale) {
            amount = amount.setScale(maxScale, RoundingMode.HALF_UP);
            if (amount.signum() == 0) {
                throw new InvalidPriceException(ValidationErrorKind.NON_POSITIVE_AMOUNT);
            }
        }
        return normalize(amount);
    }

    /**
     * Drops trailing zeros so that 100, 100.0 and "1e2" are stored as the same value.
     */
    private static BigDecimal normalize(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
