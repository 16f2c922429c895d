package guraa.uicompare.config;

import guraa.uicompare.model.ComparisonThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Comparison comparison = new Comparison();

    public Comparison getComparison() {
        return comparison;
    }

    /**
     * Comparison configuration properties. Thresholds are used as given; range checks are the
     * caller's responsibility.
     */
    public static class Comparison {
        private double visualThreshold = ComparisonThresholds.DEFAULT_VISUAL_THRESHOLD;
        private double structuralThreshold = ComparisonThresholds.DEFAULT_STRUCTURAL_THRESHOLD;
        private final Cache cache = new Cache();

        public double getVisualThreshold() {
            return visualThreshold;
        }

        public void setVisualThreshold(double visualThreshold) {
            this.visualThreshold = visualThreshold;
        }

        public double getStructuralThreshold() {
            return structuralThreshold;
        }

        public void setStructuralThreshold(double structuralThreshold) {
            this.structuralThreshold = structuralThreshold;
        }

        public Cache getCache() {
            return cache;
        }
    }

    /**
     * Verdict cache configuration properties
     */
    public static class Cache {
        /**
         * Maximum cached verdicts; 0 keeps every verdict until the cache is cleared.
         */
        private int maxEntries = 0;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
