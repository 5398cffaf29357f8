package com.cartsafety.common.mitigation;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategies by id plus the correlation matrix between them.
 */
public final class MitigationCatalogue {

    private static final String COMPONENT = "MitigationCatalogue";

    private final Map<String, MitigationStrategy> strategies;
    private final CorrelationMatrix correlations;

    private MitigationCatalogue(Map<String, MitigationStrategy> strategies, CorrelationMatrix correlations) {
        this.strategies = Collections.unmodifiableMap(strategies);
        this.correlations = correlations;
    }

    /**
     * @throws DataInconsistencyException on a duplicate strategy id, or a correlation
     *                                    entry naming a strategy that is not catalogued
     */
    public static MitigationCatalogue of(List<MitigationStrategy> strategies, CorrelationMatrix correlations) {
        Map<String, MitigationStrategy> byId = new LinkedHashMap<>();
        for (MitigationStrategy strategy : strategies) {
            if (byId.putIfAbsent(strategy.id(), strategy) != null) {
                throw new DataInconsistencyException(COMPONENT, "duplicate strategy id " + strategy.id());
            }
        }
        for (CorrelationEntry entry : correlations.entries()) {
            if (!byId.containsKey(entry.first()) || !byId.containsKey(entry.second())) {
                throw new DataInconsistencyException(COMPONENT, String.format(
                    "correlation (%s, %s) references an unknown strategy", entry.first(), entry.second()));
            }
        }
        return new MitigationCatalogue(byId, correlations);
    }

    public MitigationStrategy strategy(String id) {
        MitigationStrategy strategy = strategies.get(id);
        if (strategy == null) {
            throw new InputValidationException(COMPONENT,
                "Unknown strategy '" + id + "'. Available: " + strategies.keySet());
        }
        return strategy;
    }

    public Map<String, MitigationStrategy> strategies() {
        return strategies;
    }

    public CorrelationMatrix correlations() {
        return correlations;
    }
}
