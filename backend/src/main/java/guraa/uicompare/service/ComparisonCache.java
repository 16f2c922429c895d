package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonVerdict;

import java.util.Collection;

/**
 * Store of comparison verdicts keyed by the fingerprint of their inputs.
 * Implementations must be safe for concurrent use.
 */
public interface ComparisonCache {

    /**
     * @param fingerprint The input fingerprint
     * @return The cached verdict, or null if none
     */
    ComparisonVerdict get(ComparisonFingerprint fingerprint);

    void put(ComparisonFingerprint fingerprint, ComparisonVerdict verdict);

    void clear();

    int size();

    /**
     * @return Zero when the cache is unbounded
     */
    int maxEntries();

    /**
     * @return A snapshot of the cached verdicts
     */
    Collection<ComparisonVerdict> values();
}
