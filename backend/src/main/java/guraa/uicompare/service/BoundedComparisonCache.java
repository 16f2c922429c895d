package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonVerdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict cache holding at most {@code maxEntries} verdicts, evicting the least recently used.
 */
public class BoundedComparisonCache implements ComparisonCache {

    private final int maxEntries;
    private final Map<ComparisonFingerprint, ComparisonVerdict> resultCache;

    public BoundedComparisonCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.resultCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ComparisonFingerprint, ComparisonVerdict> eldest) {
                return size() > BoundedComparisonCache.this.maxEntries;
            }
        };
    }

    @Override
    public synchronized ComparisonVerdict get(ComparisonFingerprint fingerprint) {
        return resultCache.get(fingerprint);
    }

    @Override
    public synchronized void put(ComparisonFingerprint fingerprint, ComparisonVerdict verdict) {
        resultCache.put(fingerprint, verdict);
    }

    @Override
    public synchronized void clear() {
        resultCache.clear();
    }

    @Override
    public synchronized int size() {
        return resultCache.size();
    }

    @Override
    public int maxEntries() {
        return maxEntries;
    }

    @Override
    public synchronized Collection<ComparisonVerdict> values() {
        return new ArrayList<>(resultCache.values());
    }
}
