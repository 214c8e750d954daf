package org.dbreport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Weights applied to each {@link Dimension} when computing the overall score.
 * 
 * <p>Defaults: scalability 0.35, throughput 0.25, latency 0.20, reliability 0.15,
 * consistency 0.05. Overrides may replace any subset. Weights are not required to
 * sum to 1; callers that override them are responsible for a sensible total.
 * 
 * <p>Instances are immutable.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class WeightConfiguration {
    private static final Logger LOG = Logger.getLogger(WeightConfiguration.class.getName());

    private static final WeightConfiguration DEFAULTS;

    static {
        EnumMap<Dimension, Double> w = new EnumMap<>(Dimension.class);
        for (Dimension d : Dimension.values()) {
            w.put(d, d.getDefaultWeight());
        }
        DEFAULTS = new WeightConfiguration(w);
    }

    private final EnumMap<Dimension, Double> weights;

    private WeightConfiguration(EnumMap<Dimension, Double> weights) {
        this.weights = weights;
    }

    public static WeightConfiguration defaults() {
        return DEFAULTS;
    }

    public double weight(Dimension dimension) {
        return weights.get(dimension);
    }

    public double total() {
        double sum = 0.0;
        for (double w : weights.values()) {
            sum += w;
        }
        return sum;
    }

    /**
     * Returns a copy with the given weights replaced. Unknown keys are logged and ignored.
     * 
     * @param overrides Dimension key to weight, e.g. {@code {"throughput": 0.5}}
     * @return The merged configuration
     */
    public WeightConfiguration withOverrides(Map<String, Double> overrides) {
        EnumMap<Dimension, Double> merged = new EnumMap<>(weights);
        for (Map.Entry<String, Double> e : overrides.entrySet()) {
            Dimension d = Dimension.fromKey(e.getKey());
            if (d == null) {
                LOG.warning(() -> "Ignoring weight for unknown dimension '" + e.getKey() + "'");
                continue;
            }
            merged.put(d, e.getValue());
        }
        return new WeightConfiguration(merged);
    }

    /**
     * Parses a weight override from JSON.
     * 
     * @param json A JSON object such as {@code {"throughput":0.5,"latency":0.3}}
     * @return The parsed key-to-weight mapping, in input order
     * @throws MalformedWeightsException If the input is not a JSON object whose values are all numbers
     */
    public static Map<String, Double> parseOverrides(String json) throws MalformedWeightsException {
        if (json == null || json.isBlank()) {
            throw new MalformedWeightsException("Weight override is empty");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedWeightsException("Weight override is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWeightsException("Weight override must be a JSON object");
        }
        Map<String, Double> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new MalformedWeightsException("Weight for '" + field.getKey() + "' is not a number: " + field.getValue());
            }
            parsed.put(field.getKey(), field.getValue().doubleValue());
        }
        return parsed;
    }

    /**
     * Returns the weights keyed by dimension key, in dimension order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (Map.Entry<Dimension, Double> e : weights.entrySet()) {
            m.put(e.getKey().getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightConfiguration)) return false;
        return weights.equals(((WeightConfiguration) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
