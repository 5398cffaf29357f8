package com.cartsafety.signal.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OpenFdaClientTest {

    private static final String TOTAL_1234 = "{\"meta\":{\"results\":{\"skip\":0,\"limit\":1,\"total\":1234}},\"results\":[]}";

    private final AtomicReference<URI> lastRequest = new AtomicReference<>();

    private OpenFdaClient client(HttpStatus status, String body, String apiKey) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://api.fda.gov")
            .exchangeFunction((ClientRequest request) -> {
                lastRequest.set(request.url());
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new OpenFdaClient(webClient, apiKey);
    }

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("200 → meta.results.total")
        void total() {
            StepVerifier.create(client(HttpStatus.OK, TOTAL_1234, null)
                    .count(ReportQuery.cases("KYMRIAH", "Cytokine release syndrome", null)))
                .expectNext(1234L)
                .verifyComplete();
        }

        @Test
        @DisplayName("404 No matches found → zero, not an error")
        void notFound() {
            String body = "{\"error\":{\"code\":\"NOT_FOUND\",\"message\":\"No matches found!\"}}";
            StepVerifier.create(client(HttpStatus.NOT_FOUND, body, null).count(ReportQuery.drugTotal("NOPE", null)))
                .expectNext(0L)
                .verifyComplete();
        }

        @Test
        @DisplayName("429 → RateLimitedException")
        void tooManyRequests() {
            StepVerifier.create(client(HttpStatus.TOO_MANY_REQUESTS, "{}", null).count(ReportQuery.databaseTotal(null)))
                .expectError(RateLimitedException.class)
                .verify();
        }

        @Test
        @DisplayName("500 → ReportSourceException")
        void serverError() {
            StepVerifier.create(client(HttpStatus.INTERNAL_SERVER_ERROR, "{}", null).count(ReportQuery.databaseTotal(null)))
                .expectErrorMatches(e -> e instanceof ReportSourceException && !(e instanceof RateLimitedException))
                .verify();
        }

        @Test
        @DisplayName("200 with a non-JSON body → ReportSourceException")
        void unreadableBody() {
            StepVerifier.create(client(HttpStatus.OK, "<html>gateway hiccup</html>", null)
                    .count(ReportQuery.databaseTotal(null)))
                .expectErrorMatches(e -> e instanceof ReportSourceException
                    && !(e instanceof RateLimitedException)
                    && e.getMessage().contains("unreadable body"))
                .verify();
        }

        @Test
        @DisplayName("body without a total → ReportSourceException")
        void missingTotal() {
            StepVerifier.create(client(HttpStatus.OK, "{\"results\":[]}", null).count(ReportQuery.databaseTotal(null)))
                .expectError(ReportSourceException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("Query construction")
    class Queries {

        @Test
        @DisplayName("drug-event pair → brand/generic name clause AND reaction term, limit 1")
        void pairQuery() {
            client(HttpStatus.OK, TOTAL_1234, null)
                .count(ReportQuery.cases("KYMRIAH", "Cytokine release syndrome", null)).block();

            URI uri = lastRequest.get();
            assertEquals("/drug/event.json", uri.getPath());
            assertTrue(uri.getQuery().contains("limit=1"));
            assertTrue(uri.getQuery().contains(
                "search=(patient.drug.openfda.brand_name:\"KYMRIAH\" OR patient.drug.openfda.generic_name:\"KYMRIAH\")"
                    + " AND patient.reaction.reactionmeddrapt:\"Cytokine release syndrome\""));
        }

        @Test
        @DisplayName("database total without asOf → no search clause at all")
        void unfilteredTotal() {
            client(HttpStatus.OK, TOTAL_1234, null).count(ReportQuery.databaseTotal(null)).block();

            assertFalse(lastRequest.get().getQuery().contains("search="));
            assertNull(OpenFdaClient.searchExpression(ReportQuery.databaseTotal(null)));
        }

        @Test
        @DisplayName("asOf → receive-date range clause")
        void asOf() {
            String search = OpenFdaClient.searchExpression(ReportQuery.databaseTotal(LocalDate.of(2024, 6, 30)));
            assertEquals("receivedate:[19000101 TO 20240630]", search);
        }

        @Test
        @DisplayName("quotes inside a term are stripped")
        void quotes() {
            String search = OpenFdaClient.searchExpression(ReportQuery.eventTotal("Neuro\"toxicity", null));
            assertEquals("patient.reaction.reactionmeddrapt:\"Neurotoxicity\"", search);
        }

        @Test
        @DisplayName("configured API key is sent as api_key")
        void apiKey() {
            client(HttpStatus.OK, TOTAL_1234, "secret").count(ReportQuery.databaseTotal(null)).block();

            assertTrue(lastRequest.get().getQuery().contains("api_key=secret"));
        }
    }
}
