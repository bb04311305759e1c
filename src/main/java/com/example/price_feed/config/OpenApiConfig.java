package com.example.price_feed.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI priceFeedOpenAPI(PriceFeedProperties properties,
                                    @Value("${server.port:8080}") int port) {
        String description = "Reads the current asset prices and accepts manual price overrides. "
                + "Registered symbols: " + String.join(", ", properties.getSymbols())
                + ". Currencies: " + String.join(", ", properties.getCurrencies())
                + ". Amounts are kept to " + properties.getPrecision() + " decimal places.";

        return new OpenAPI()
                .info(new Info()
                        .title("Price Feed API")
                        .description(description)
                        .version("1.0"))
                .addServersItem(new Server()
                        .url("http://localhost:" + port)
                        .description("Local instance"));
    }
}
