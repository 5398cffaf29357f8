package com.cartsafety.signal.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts reports in the openFDA drug-event endpoint.
 *
 * <p>Every query asks for {@code limit=1} and reads {@code meta.results.total}. Drug terms
 * match brand or generic name; event terms match the MedDRA preferred term. The
 * database total is a query with no search clause at all (or only the receive-date
 * range when {@code asOf} is set), never extrapolated from a proxy term.
 *
 * <p>openFDA answers 404 when nothing matches; that is a count of zero. A 2xx body that
 * is not JSON is a source failure, like a 5xx.
 */
public class OpenFdaClient implements ReportCountSource {

    private static final Logger log = LoggerFactory.getLogger(OpenFdaClient.class);

    private static final String EVENT_PATH = "/drug/event.json";
    private static final String EARLIEST_RECEIVE_DATE = "19000101";

    private final WebClient webClient;
    private final String apiKey;

    public OpenFdaClient(WebClient openFdaWebClient, String apiKey) {
        this.webClient = openFdaWebClient;
        this.apiKey = apiKey;
    }

    @Override
    public Mono<Long> count(ReportQuery query) {
        String search = searchExpression(query);
        Map<String, Object> variables = new HashMap<>();
        if (search != null) {
            variables.put("search", search);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            variables.put("apiKey", apiKey);
        }

        return webClient.get()
            .uri(builder -> {
                builder.path(EVENT_PATH).queryParam("limit", 1);
                if (variables.containsKey("search")) {
                    builder.queryParam("search", "{search}");
                }
                if (variables.containsKey("apiKey")) {
                    builder.queryParam("api_key", "{apiKey}");
                }
                return builder.build(variables);
            })
            .exchangeToMono(response -> {
                int status = response.statusCode().value();
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(JsonNode.class).map(root -> total(root, query));
                }
                if (status == 404) {
                    return response.releaseBody().thenReturn(0L);
                }
                if (status == 429) {
                    return response.releaseBody().then(Mono.<Long>error(
                        new RateLimitedException("openFDA refused the request (HTTP 429) for " + query.cacheKey())));
                }
                return response.releaseBody().then(Mono.<Long>error(
                    new ReportSourceException("openFDA answered HTTP " + status + " for " + query.cacheKey())));
            })
            .onErrorMap(WebClientRequestException.class,
                e -> new ReportSourceException("openFDA request failed: " + e.getMessage(), e))
            .onErrorMap(CodecException.class,
                e -> new ReportSourceException("openFDA returned an unreadable body for " + query.cacheKey()
                    + ": " + e.getMessage(), e))
            .doOnNext(total -> log.debug("OPENFDA_COUNT key={} total={}", query.cacheKey(), total));
    }

    /** The openFDA search clause for {@code query}, or null for an unrestricted count. */
    static String searchExpression(ReportQuery query) {
        List<String> clauses = new ArrayList<>(3);
        if (query.drugTerm() != null) {
            String drug = quoted(query.drugTerm());
            clauses.add("(patient.drug.openfda.brand_name:" + drug
                + " OR patient.drug.openfda.generic_name:" + drug + ")");
        }
        if (query.eventTerm() != null) {
            clauses.add("patient.reaction.reactionmeddrapt:" + quoted(query.eventTerm()));
        }
        if (query.asOf() != null) {
            clauses.add("receivedate:[" + EARLIEST_RECEIVE_DATE + " TO "
                + query.asOf().format(DateTimeFormatter.BASIC_ISO_DATE) + "]");
        }
        return clauses.isEmpty() ? null : String.join(" AND ", clauses);
    }

    private static String quoted(String term) {
        return "\"" + term.replace("\"", "").trim() + "\"";
    }

    private static long total(JsonNode root, ReportQuery query) {
        JsonNode total = root.path("meta").path("results").path("total");
        if (!total.canConvertToLong()) {
            throw new ReportSourceException("openFDA response carries no meta.results.total for " + query.cacheKey());
        }
        return total.asLong();
    }
}
