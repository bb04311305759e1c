package com.example.price_feed.controller;

import com.example.price_feed.model.PriceEntry;
import com.example.price_feed.model.SetPriceRequest;
import com.example.price_feed.service.PriceStore;
import com.example.price_feed.validation.InvalidPriceException;
import com.example.price_feed.validation.PriceRequestValidator;
import com.example.price_feed.validation.UnknownSymbolException;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Price API", description = "Read current prices and set them manually")
public class PriceFeedController {

    private static final Logger logger = LoggerFactory.getLogger(PriceFeedController.class);

    private final PriceStore priceStore;
    private final PriceRequestValidator validator;

    public PriceFeedController(PriceStore priceStore, PriceRequestValidator validator) {
        this.priceStore = priceStore;
        this.validator = validator;
    }

    @Operation(summary = "Get All Prices", description = "Lists the current price of every symbol in every currency it has been priced in. Empty until a price is set.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Current prices, possibly none",
                    content = @Content(mediaType = "application/json",
                            array = @ArraySchema(schema = @Schema(implementation = PriceEntry.class))))
    })
    @GetMapping("/prices")
    public List<PriceEntry> getAllPrices() {
        return priceStore.getAllPrices();
    }

    @Operation(summary = "Set Price", description = "Sets the price of a registered symbol in one currency, replacing the previous value for that pair.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Price stored",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PriceEntry.class))),
            @ApiResponse(responseCode = "400", description = "Missing, malformed or out-of-range field", content = @Content),
            @ApiResponse(responseCode = "404", description = "Symbol is not registered", content = @Content)
    })
    @PostMapping("/set-price")
    public PriceEntry setPrice(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "symbol, amount (number or numeric string) and currency type",
                    required = true
            )
            @RequestBody SetPriceRequest request) {
        PriceEntry entry = validator.validate(request);
        priceStore.setPrice(entry);
        return entry;
    }

    @ExceptionHandler(InvalidPriceException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @Hidden
    public Map<String, String> handleInvalidPrice(InvalidPriceException ex) {
        logger.warn("Rejected price update ({}): {}", ex.getKind(), ex.getMessage());
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @Hidden
    public Map<String, String> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Rejected price update: unreadable body");
        return Map.of("error", "Invalid request body");
    }

    @ExceptionHandler(UnknownSymbolException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    @Hidden
    public Map<String, String> handleUnknownSymbol(UnknownSymbolException ex) {
        logger.warn("Rejected price update: unknown symbol {}", ex.getSymbol());
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    @Hidden
    public Map<String, String> handleUnexpected(RuntimeException ex) {
        logger.error("Price request failed", ex);
        return Map.of("error", "Internal server error");
    }
}
