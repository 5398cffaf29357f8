package com.cartsafety.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Traceability block attached to every result.
 *
 * <ul>
 *   <li>{@code approximations}: fallback or approximate numeric paths taken</li>
 *   <li>{@code warnings}: caveats the caller must surface (heterogeneity, missing correlations, ...)</li>
 *   <li>{@code details}: method-specific values (tau², shrinkage factor, seed, ...)</li>
 * </ul>
 */
public record Diagnostics(
    @JsonProperty("approximations") List<String> approximations,
    @JsonProperty("warnings")       List<String> warnings,
    @JsonProperty("details")        Map<String, Object> details
) {

    public Diagnostics {
        approximations = List.copyOf(approximations);
        warnings = List.copyOf(warnings);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Diagnostics empty() {
        return new Diagnostics(List.of(), List.of(), Map.of());
    }

    @JsonProperty("degraded")
    public boolean degraded() {
        return !approximations.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> approximations = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder() {}

        public Builder approximation(String note) {
            approximations.add(note);
            return this;
        }

        public Builder warning(String note) {
            warnings.add(note);
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        public Builder merge(Diagnostics other) {
            approximations.addAll(other.approximations());
            warnings.addAll(other.warnings());
            details.putAll(other.details());
            return this;
        }

        public Diagnostics build() {
            return new Diagnostics(approximations, warnings, details);
        }
    }
}
