package com.cartsafety.common.config;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.mitigation.CorrelationEntry;
import com.cartsafety.common.mitigation.CorrelationMatrix;
import com.cartsafety.common.mitigation.MitigationCatalogue;
import com.cartsafety.common.mitigation.MitigationStrategy;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;
import com.cartsafety.common.signal.SignalThresholds;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link SafetyConfiguration} document. Duplicate JSON keys, duplicate
 * strategy ids, duplicate correlation pairs and duplicate products all fail the load.
 */
public final class SafetyConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(SafetyConfigurationLoader.class);

    private static final String COMPONENT = "SafetyConfiguration";

    /** Catalogue bundled with the library. */
    public static final String DEFAULT_RESOURCE = "cartsafety/default-safety-config.json";

    private final ObjectMapper mapper;

    public SafetyConfigurationLoader() {
        this.mapper = JsonMapper.builder()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .addModule(new JavaTimeModule())
            .build();
    }

    public SafetyConfiguration loadDefault() {
        InputStream in = SafetyConfigurationLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new SafetyEngineException(COMPONENT, "bundled configuration " + DEFAULT_RESOURCE + " is missing");
        }
        return load(in, DEFAULT_RESOURCE);
    }

    public SafetyConfiguration load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new SafetyEngineException(COMPONENT, "cannot read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public SafetyConfiguration load(InputStream in, String source) {
        Document document;
        try (InputStream stream = in) {
            document = mapper.readValue(stream, Document.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof SafetyEngineException rejected) {
                throw rejected;
            }
            // duplicate keys surface here as JsonParseException
            throw new DataInconsistencyException(COMPONENT,
                "invalid configuration document " + source + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new SafetyEngineException(COMPONENT, "cannot read configuration " + source, e);
        }

        SafetyConfiguration configuration = new SafetyConfiguration(
            document.version(),
            document.priors() == null ? Map.of() : document.priors(),
            document.clinicalThresholds() == null ? Map.of() : document.clinicalThresholds(),
            MitigationCatalogue.of(
                document.strategies() == null ? List.of() : document.strategies(),
                CorrelationMatrix.of(document.correlations() == null ? List.of() : document.correlations())),
            document.signalThresholds(),
            document.products() == null ? List.of() : document.products(),
            document.targetEvents() == null ? List.of() : document.targetEvents());

        log.info("SAFETY_CONFIG_LOADED source={} version={} priors={} strategies={} products={}",
            source, configuration.version(), configuration.priors().size(),
            configuration.mitigations().strategies().size(), configuration.products().size());
        return configuration;
    }

    public record Document(
        @JsonProperty("version")            String version,
        @JsonProperty("priors")             Map<AdverseEventType, PriorSpecification> priors,
        @JsonProperty("clinicalThresholds") Map<AdverseEventType, Double> clinicalThresholds,
        @JsonProperty("strategies")         List<MitigationStrategy> strategies,
        @JsonProperty("correlations")       List<CorrelationEntry> correlations,
        @JsonProperty("signalThresholds")   SignalThresholds signalThresholds,
        @JsonProperty("products")           List<ProductDefinition> products,
        @JsonProperty("targetEvents")       List<String> targetEvents
    ) {}
}
