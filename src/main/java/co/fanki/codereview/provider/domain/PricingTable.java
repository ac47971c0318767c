package co.fanki.codereview.provider.domain;

import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-model token prices, in dollars per thousand tokens.
 *
 * <p>A model id matches an entry when it equals the entry's key or starts
 * with it, so dated ids such as {@code claude-sonnet-4-20250514} resolve to
 * {@code claude-sonnet-4}. The longest matching key wins. Models without a
 * price cost nothing and are logged once per lookup at WARN.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PricingTable {

    private static final Logger LOG = LoggerFactory.getLogger(
            PricingTable.class);

    private final Map<String, Rate> rates;

    /**
     * Creates a table from the given rates.
     *
     * @param theRates model id prefix to rate
     */
    public PricingTable(final Map<String, Rate> theRates) {
        Preconditions.requireNonNull(theRates, "Rates are required");
        this.rates = Collections.unmodifiableMap(new LinkedHashMap<>(theRates));
    }

    /**
     * Returns the table with the default public prices.
     *
     * @return the default table
     */
    public static PricingTable defaults() {
        final Map<String, Rate> rates = new LinkedHashMap<>();
        rates.put("claude-sonnet-4", new Rate(0.003, 0.015));
        rates.put("claude-opus-4", new Rate(0.015, 0.075));
        rates.put("gpt-4-turbo", new Rate(0.01, 0.03));
        rates.put("gpt-4o", new Rate(0.005, 0.015));
        return new PricingTable(rates);
    }

    /**
     * Returns a copy of this table with extra or replaced prices.
     *
     * <p>Each entry reads {@code model=input/output}, for example
     * {@code gpt-4o-mini=0.00015/0.0006}.</p>
     *
     * @param entries the price entries, never null
     * @return the new table
     * @throws IllegalArgumentException if an entry is malformed
     */
    public PricingTable withOverrides(final List<String> entries) {
        Preconditions.requireNonNull(entries, "Entries are required");
        final Map<String, Rate> merged = new LinkedHashMap<>(rates);
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            final int eq = entry.indexOf('=');
            final int slash = entry.indexOf('/', eq + 1);
            if (eq <= 0 || slash < 0) {
                throw new IllegalArgumentException(
                        "Price entry must read model=input/output: " + entry);
            }
            try {
                merged.put(entry.substring(0, eq).trim(), new Rate(
                        Double.parseDouble(entry.substring(eq + 1, slash).trim()),
                        Double.parseDouble(entry.substring(slash + 1).trim())));
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Price entry has a bad number: " + entry, e);
            }
        }
        return new PricingTable(merged);
    }

    /**
     * Computes the cost of a call.
     *
     * @param model the model id
     * @param inputTokens prompt tokens
     * @param outputTokens completion tokens
     * @return the cost in dollars, 0 for unknown models
     */
    public double cost(final String model, final long inputTokens,
            final long outputTokens) {
        final Rate rate = rateFor(model);
        if (rate == null) {
            LOG.warn("No price configured for model {}, counting cost as 0",
                    model);
            return 0.0;
        }
        return inputTokens / 1000.0 * rate.input()
                + outputTokens / 1000.0 * rate.output();
    }

    Rate rateFor(final String model) {
        if (model == null) {
            return null;
        }
        Rate found = null;
        int matched = -1;
        for (Map.Entry<String, Rate> entry : rates.entrySet()) {
            final String key = entry.getKey();
            if (model.startsWith(key) && key.length() > matched) {
                found = entry.getValue();
                matched = key.length();
            }
        }
        return found;
    }

    /**
     * Price of one model.
     *
     * @param input dollars per thousand prompt tokens
     * @param output dollars per thousand completion tokens
     */
    public record Rate(double input, double output) {

        /** Compact constructor. */
        public Rate {
            Preconditions.requireNonNegative(input, "Input rate cannot be negative");
            Preconditions.requireNonNegative(output, "Output rate cannot be negative");
        }
    }

}
