package com.cartsafety.common.mitigation;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symmetric pairwise correlation lookup. Pairs without an entry read as 0
 * (independence); {@link #isExplicit} tells the two cases apart.
 */
public final class CorrelationMatrix {

    private static final String COMPONENT = "CorrelationMatrix";

    private final Map<String, CorrelationEntry> entries;

    private CorrelationMatrix(Map<String, CorrelationEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static CorrelationMatrix empty() {
        return new CorrelationMatrix(new LinkedHashMap<>());
    }

    /**
     * @throws InputValidationException   if a coefficient is outside [0, 1] or pairs a strategy with itself
     * @throws DataInconsistencyException if the same unordered pair appears twice
     */
    public static CorrelationMatrix of(List<CorrelationEntry> values) {
        Map<String, CorrelationEntry> byPair = new LinkedHashMap<>();
        for (CorrelationEntry entry : values) {
            InputValidationException.require(entry.first() != null && entry.second() != null, COMPONENT,
                "correlation entries need two strategy ids");
            InputValidationException.require(!entry.first().equals(entry.second()), COMPONENT,
                "strategy " + entry.first() + " cannot be correlated with itself");
            InputValidationException.require(Double.isFinite(entry.rho()) && entry.rho() >= 0.0 && entry.rho() <= 1.0,
                COMPONENT, String.format("rho for (%s, %s) must be in [0, 1], got %s",
                    entry.first(), entry.second(), entry.rho()));
            CorrelationEntry previous = byPair.putIfAbsent(key(entry.first(), entry.second()), entry);
            if (previous != null) {
                throw new DataInconsistencyException(COMPONENT, String.format(
                    "duplicate correlation entry for (%s, %s): %s and %s",
                    entry.first(), entry.second(), previous.rho(), entry.rho()));
            }
        }
        return new CorrelationMatrix(byPair);
    }

    public double rho(String a, String b) {
        CorrelationEntry entry = entries.get(key(a, b));
        return entry == null ? 0.0 : entry.rho();
    }

    public boolean isExplicit(String a, String b) {
        return entries.containsKey(key(a, b));
    }

    public List<CorrelationEntry> entries() {
        return List.copyOf(entries.values());
    }

    private static String key(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
