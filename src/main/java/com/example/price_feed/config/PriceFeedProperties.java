package com.example.price_feed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registry of the symbols and currency codes the service accepts prices for.
 * Bound from {@code app.prices.*}.
 */
@Component
@ConfigurationProperties(prefix = "app.prices")
public class PriceFeedProperties {

    private List<String> symbols = new ArrayList<>(List.of("bitcoin", "ethereum"));
    private List<String> currencies = new ArrayList<>(List.of("USD", "EUR"));
    private int precision = 6;

    public List<String> getSymbols() {
        return symbols;
    }

    public void setSymbols(List<String> symbols) {
        this.symbols = symbols;
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    public void setCurrencies(List<String> currencies) {
        this.currencies = currencies;
    }

    public int getPrecision() {
        return precision;
    }

    public void setPrecision(int precision) {
        this.precision = precision;
    }

    /**
     * Looks up a symbol ignoring case.
     *
     * @return the registered spelling of the symbol, or empty if it is not registered
     */
    public Optional<String> findSymbol(String symbol) {
        String wanted = symbol.trim().toLowerCase(Locale.ROOT);
        return symbols.stream()
                .map(String::trim)
                .filter(s -> s.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public boolean isSupportedCurrency(String type) {
        return currencies.stream().map(String::trim).anyMatch(c -> c.equals(type));
    }
}
