package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonVerdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded verdict cache. Entries live until {@link #clear()}.
 */
public class InMemoryComparisonCache implements ComparisonCache {

    private final Map<ComparisonFingerprint, ComparisonVerdict> resultCache = new ConcurrentHashMap<>();

    @Override
    public ComparisonVerdict get(ComparisonFingerprint fingerprint) {
        return resultCache.get(fingerprint);
    }

    @Override
    public void put(ComparisonFingerprint fingerprint, ComparisonVerdict verdict) {
        resultCache.put(fingerprint, verdict);
    }

    @Override
    public void clear() {
        resultCache.clear();
    }

    @Override
    public int size() {
        return resultCache.size();
    }

    @Override
    public int maxEntries() {
        return 0;
    }

    @Override
    public Collection<ComparisonVerdict> values() {
        return new ArrayList<>(resultCache.values());
    }
}
