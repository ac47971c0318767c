package co.fanki.codereview.review.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Recognized review toggles.
 *
 * <p>Every toggle defaults to enabled. Keys that are not recognized are
 * ignored and logged at DEBUG, never rejected.</p>
 *
 * @param enableSecurity run the security producer
 * @param enablePerformance run the optimizer producer
 * @param enableDocumentation run the documenter producer
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReviewOptions(
        boolean enableSecurity,
        boolean enablePerformance,
        boolean enableDocumentation) {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewOptions.class);

    /** Key enabling the security producer. */
    public static final String ENABLE_SECURITY = "enable_security";

    /** Key enabling the optimizer producer. */
    public static final String ENABLE_PERFORMANCE = "enable_performance";

    /** Key enabling the documenter producer. */
    public static final String ENABLE_DOCUMENTATION = "enable_documentation";

    /**
     * Returns the options with every producer enabled.
     *
     * @return the defaults
     */
    public static ReviewOptions defaults() {
        return new ReviewOptions(true, true, true);
    }

    /**
     * Reads options from a free-form map as received over the wire.
     *
     * <p>Boolean values and the strings {@code "true"} / {@code "false"}
     * are accepted; anything else for a recognized key keeps the
     * default.</p>
     *
     * @param raw the raw options, may be null
     * @return the options
     */
    public static ReviewOptions fromMap(final Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return defaults();
        }
        boolean security = true;
        boolean performance = true;
        boolean documentation = true;
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            switch (entry.getKey()) {
                case ENABLE_SECURITY -> security = flag(entry.getValue(), true);
                case ENABLE_PERFORMANCE -> performance = flag(entry.getValue(), true);
                case ENABLE_DOCUMENTATION -> documentation = flag(entry.getValue(), true);
                default -> LOG.debug("Ignoring unrecognized review option: {}",
                        entry.getKey());
            }
        }
        return new ReviewOptions(security, performance, documentation);
    }

    private static boolean flag(final Object value, final boolean fallback) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return false;
            }
        }
        return fallback;
    }

}
