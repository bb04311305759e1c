package com.example.price_feed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceFeedApplication.class, args);
    }
}
