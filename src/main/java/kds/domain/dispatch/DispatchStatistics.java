package kds.domain.dispatch;

import javax.inject.Singleton;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operational counters of the dispatch pipeline
 * @since 08/10/2026
 */
@Singleton
public class DispatchStatistics {
    private final Map<String, AtomicLong> successCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failureCounts = new ConcurrentHashMap<>();
    private final AtomicLong totalItemsSent = new AtomicLong();
    private final AtomicLong totalOrdersSent = new AtomicLong();
    private volatile long lastSuccessfulSend = 0;

    public void recordSuccess(String printerId) {
        successCounts.computeIfAbsent(printerId, k -> new AtomicLong()).incrementAndGet();
        lastSuccessfulSend = System.currentTimeMillis();
    }

    public void recordFailure(String printerId) {
        failureCounts.computeIfAbsent(printerId, k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Count a dispatch that reached at least one printer
     */
    public void recordDispatch(int itemCount) {
        totalOrdersSent.incrementAndGet();
        totalItemsSent.addAndGet(itemCount);
    }

    public long getSuccessCount(String printerId) {
        AtomicLong count = successCounts.get(printerId);
        return count == null ? 0 : count.get();
    }

    public long getFailureCount(String printerId) {
        AtomicLong count = failureCounts.get(printerId);
        return count == null ? 0 : count.get();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                totalOrdersSent.get(),
                totalItemsSent.get(),
                lastSuccessfulSend == 0 ? null : lastSuccessfulSend,
                copy(successCounts),
                copy(failureCounts));
    }

    public void reset() {
        successCounts.clear();
        failureCounts.clear();
        totalItemsSent.set(0);
        totalOrdersSent.set(0);
        lastSuccessfulSend = 0;
    }

    private static Map<String, Long> copy(Map<String, AtomicLong> counts) {
        Map<String, Long> result = new TreeMap<>();
        counts.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }

    public record Snapshot(long totalOrdersSent, long totalItemsSent, Long lastSuccessfulSend,
                           Map<String, Long> successCounts, Map<String, Long> failureCounts) {
    }
}
