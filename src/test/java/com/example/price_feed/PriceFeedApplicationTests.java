package com.example.price_feed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.stream.Stream;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end scenarios against the full application context. Each test gets a fresh, empty store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PriceFeedApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("A fresh service lists no prices")
    void freshStoreIsEmpty() throws Exception {
        mockMvc.perform(get("/prices"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    @DisplayName("A price that is set shows up in /prices")
    void setThenList() throws Exception {
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":\"USD\"}")
                .andExpect(status().isOk());

        mockMvc.perform(get("/prices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].Symbol").value("bitcoin"))
                .andExpect(jsonPath("$[0].Amount").value(100))
                .andExpect(jsonPath("$[0].Type").value("USD"));
    }

    @Test
    @DisplayName("Later sets overwrite earlier ones for the same pair")
    void lastWriteWins() throws Exception {
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":\"USD\"}").andExpect(status().isOk());
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":90,\"type\":\"EUR\"}").andExpect(status().isOk());
        setPrice("{\"symbol\":\"Bitcoin\",\"amount\":\"120\",\"type\":\"USD\"}").andExpect(status().isOk());
        setPrice("{\"symbol\":\"ethereum\",\"amount\":3000,\"type\":\"USD\"}").andExpect(status().isOk());

        mockMvc.perform(get("/prices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].Symbol").value("bitcoin"))
                .andExpect(jsonPath("$[0].Type").value("EUR"))
                .andExpect(jsonPath("$[1].Symbol").value("bitcoin"))
                .andExpect(jsonPath("$[1].Type").value("USD"))
                .andExpect(jsonPath("$[1].Amount").value(120))
                .andExpect(jsonPath("$[2].Symbol").value("ethereum"));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("rejectedPayloads")
    @DisplayName("Rejected set-price calls return the right status and leave the store empty")
    void rejectedPayloadsDoNotMutate(String payload, int expectedStatus) throws Exception {
        setPrice(payload).andExpect(status().is(expectedStatus));

        mockMvc.perform(get("/prices"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    static Stream<Arguments> rejectedPayloads() {
        return Stream.of(
                Arguments.of("{\"symbol\":\"\",\"amount\":100,\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":-100,\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":\"abc\",\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":100}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":\"ABC\"}", 400),
                Arguments.of("{\"symbol\":123,\"amount\":100,\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":true,\"amount\":100,\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":1}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":\"1e-20000000\",\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"bitcoin\",\"amount\":\"1e999999999\",\"type\":\"USD\"}", 400),
                Arguments.of("{\"symbol\":\"unknown\",\"amount\":100,\"type\":\"USD\"}", 404)
        );
    }

    @Test
    @DisplayName("A rejected update leaves an existing price untouched")
    void rejectedUpdateKeepsPreviousPrice() throws Exception {
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":\"USD\"}").andExpect(status().isOk());
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":-100,\"type\":\"USD\"}").andExpect(status().isBadRequest());

        mockMvc.perform(get("/prices"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].Amount").value(100));
    }

    @Test
    @DisplayName("Setting one amount in different notations leaves the same listing")
    void sameAmountDifferentNotation() throws Exception {
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":100,\"type\":\"USD\"}").andExpect(status().isOk());
        String once = mockMvc.perform(get("/prices")).andReturn().getResponse().getContentAsString();

        setPrice("{\"symbol\":\"bitcoin\",\"amount\":100.0,\"type\":\"USD\"}").andExpect(status().isOk());
        setPrice("{\"symbol\":\"bitcoin\",\"amount\":\"100.00\",\"type\":\"USD\"}").andExpect(status().isOk());

        mockMvc.perform(get("/prices"))
                .andExpect(status().isOk())
                .andExpect(content().string(once));
    }

    @Test
    @DisplayName("CORS preflight is answered for the configured methods")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/set-price")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Content-Type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }

    @Test
    @DisplayName("OpenAPI description is published")
    void openApiDocs() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Price Feed API"))
                .andExpect(jsonPath("$.info.description").value(containsString("bitcoin, ethereum")))
                .andExpect(jsonPath("$.servers[0].url").value("http://localhost:8080"));
    }

    private ResultActions setPrice(String payload) throws Exception {
        return mockMvc.perform(post("/set-price")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload));
    }
}
