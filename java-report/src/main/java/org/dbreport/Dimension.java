package org.dbreport;

/**
 * The performance dimensions that make up the overall score.
 * 
 * <p>Each dimension carries the key used in weight overrides and the default
 * weight applied when no override is given.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public enum Dimension {
    SCALABILITY("scalability", 0.35),
    THROUGHPUT("throughput", 0.25),
    LATENCY("latency", 0.20),
    RELIABILITY("reliability", 0.15),
    CONSISTENCY("consistency", 0.05);

    private final String key;
    private final double defaultWeight;

    Dimension(String key, double defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    public String getKey() {
        return key;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    /**
     * Name of the score field in rendered records, e.g. {@code latencyScore}.
     */
    public String scoreField() {
        return key + "Score";
    }

    /**
     * Looks up a dimension by its override key.
     * 
     * @param key Key such as {@code "throughput"}
     * @return The dimension, or {@code null} if the key is unknown
     */
    public static Dimension fromKey(String key) {
        for (Dimension d : values()) {
            if (d.key.equals(key)) {
                return d;
            }
        }
        return null;
    }
}
