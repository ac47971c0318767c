package co.fanki.codereview.provider.domain;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide running total of provider spend.
 *
 * <p>Increments come from concurrent producer threads and may interleave;
 * the totals are sums, so the order does not matter. Only the gateway
 * records spend.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CostLedger {

    private final DoubleAdder total = new DoubleAdder();

    private final LongAdder requests = new LongAdder();

    private final LongAdder failures = new LongAdder();

    private final Map<String, DoubleAdder> byProvider = new ConcurrentHashMap<>();

    void record(final String provider, final double cost) {
        total.add(cost);
        requests.increment();
        byProvider.computeIfAbsent(provider, k -> new DoubleAdder()).add(cost);
    }

    void recordFailure() {
        failures.increment();
    }

    public double totalCost() {
        return total.sum();
    }

    public long requestCount() {
        return requests.sum();
    }

    public long failureCount() {
        return failures.sum();
    }

    /**
     * Returns the spend per provider, sorted by provider name.
     *
     * @return provider name to dollars
     */
    public Map<String, Double> costByProvider() {
        final Map<String, Double> result = new TreeMap<>();
        byProvider.forEach((name, adder) -> result.put(name, adder.sum()));
        return result;
    }

}
