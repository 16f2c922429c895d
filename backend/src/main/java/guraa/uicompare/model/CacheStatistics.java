package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the verdict cache.
 */
@Value
@Builder
public class CacheStatistics {

    int cachedVerdicts;

    /**
     * Zero when the cache is unbounded.
     */
    int maxEntries;

    long estimatedMemoryBytes;

    @JsonProperty("estimatedMemoryMB")
    public double getEstimatedMemoryMB() {
        return estimatedMemoryBytes / (1024.0 * 1024.0);
    }
}
