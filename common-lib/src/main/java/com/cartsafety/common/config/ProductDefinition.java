package com.cartsafety.common.config;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * A marketed product as the reporting database knows it.
 *
 * @param searchTerms  name variants tried in order (brand first, then generic)
 * @param productClass explicit category, never inferred from the name
 */
public record ProductDefinition(
    @JsonProperty("brand")        String brand,
    @JsonProperty("searchTerms")  List<String> searchTerms,
    @JsonProperty("approvalDate") LocalDate approvalDate,
    @JsonProperty("productClass") String productClass
) {

    public ProductDefinition {
        InputValidationException.require(brand != null && !brand.isBlank(), "SafetyConfiguration",
            "product brand is required");
        searchTerms = searchTerms == null || searchTerms.isEmpty() ? List.of(brand) : List.copyOf(searchTerms);
    }

    public boolean matches(String name) {
        String candidate = name.trim();
        return brand.equalsIgnoreCase(candidate)
            || searchTerms.stream().anyMatch(t -> t.equalsIgnoreCase(candidate));
    }
}
