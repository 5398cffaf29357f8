package com.cartsafety.common.config;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.mitigation.MitigationCatalogue;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;
import com.cartsafety.common.signal.SignalThresholds;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned statistical configuration: priors, mitigation catalogue,
 * clinical thresholds, signal thresholds and the product catalogue.
 *
 * <p>A changed value means a new document with a new {@code version}; every response
 * echoes the version it was computed under.
 */
public final class SafetyConfiguration {

    private static final String COMPONENT = "SafetyConfiguration";

    private final String version;
    private final Map<AdverseEventType, PriorSpecification> priors;
    private final Map<AdverseEventType, Double> clinicalThresholds;
    private final MitigationCatalogue mitigations;
    private final SignalThresholds signalThresholds;
    private final Map<String, ProductDefinition> products;
    private final List<String> targetEvents;

    SafetyConfiguration(String version,
                        Map<AdverseEventType, PriorSpecification> priors,
                        Map<AdverseEventType, Double> clinicalThresholds,
                        MitigationCatalogue mitigations,
                        SignalThresholds signalThresholds,
                        List<ProductDefinition> products,
                        List<String> targetEvents) {
        InputValidationException.require(version != null && !version.isBlank(), COMPONENT,
            "configuration version is required");
        this.version = version;
        this.priors = Collections.unmodifiableMap(enumMap(priors));
        for (Map.Entry<AdverseEventType, Double> e : clinicalThresholds.entrySet()) {
            InputValidationException.require(e.getValue() != null && e.getValue() > 0.0 && e.getValue() < 1.0,
                COMPONENT, "clinical threshold for " + e.getKey() + " must be in (0, 1), got " + e.getValue());
        }
        this.clinicalThresholds = Collections.unmodifiableMap(enumMap(clinicalThresholds));
        this.mitigations = mitigations;
        this.signalThresholds = signalThresholds == null ? SignalThresholds.DEFAULT : signalThresholds;

        Map<String, ProductDefinition> byBrand = new LinkedHashMap<>();
        for (ProductDefinition product : products) {
            if (byBrand.putIfAbsent(product.brand().toUpperCase(), product) != null) {
                throw new DataInconsistencyException(COMPONENT, "duplicate product " + product.brand());
            }
        }
        this.products = Collections.unmodifiableMap(byBrand);
        this.targetEvents = List.copyOf(targetEvents);
    }

    public String version() {
        return version;
    }

    /**
     * @throws InputValidationException if no prior is configured for {@code type}
     */
    public PriorSpecification prior(AdverseEventType type) {
        PriorSpecification prior = priors.get(type);
        if (prior == null) {
            throw new InputValidationException(COMPONENT,
                "no prior configured for " + type + " in version " + version);
        }
        return prior;
    }

    public Map<AdverseEventType, PriorSpecification> priors() {
        return priors;
    }

    public Optional<Double> clinicalThreshold(AdverseEventType type) {
        return Optional.ofNullable(clinicalThresholds.get(type));
    }

    public MitigationCatalogue mitigations() {
        return mitigations;
    }

    public SignalThresholds signalThresholds() {
        return signalThresholds;
    }

    public List<ProductDefinition> products() {
        return List.copyOf(products.values());
    }

    /** Looks a product up by brand or any of its search terms. */
    public Optional<ProductDefinition> product(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        ProductDefinition byBrand = products.get(name.trim().toUpperCase());
        if (byBrand != null) {
            return Optional.of(byBrand);
        }
        return products.values().stream().filter(p -> p.matches(name)).findFirst();
    }

    public List<String> targetEvents() {
        return targetEvents;
    }

    private static <V> Map<AdverseEventType, V> enumMap(Map<AdverseEventType, V> source) {
        Map<AdverseEventType, V> copy = new EnumMap<>(AdverseEventType.class);
        copy.putAll(source);
        return copy;
    }
}
