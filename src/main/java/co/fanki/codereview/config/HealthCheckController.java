package co.fanki.codereview.config;

import co.fanki.codereview.review.application.ReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness checks.
 *
 * <p>/ready checks the database and reports the review counters.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final DataSource dataSource;
    private final ReviewService reviewService;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for connectivity checks
     * @param theReviewService the review service
     */
    public HealthCheckController(final DataSource theDataSource,
            final ReviewService theReviewService) {
        this.dataSource = theDataSource;
        this.reviewService = theReviewService;
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness check.
     *
     * @return status map with the database state and review counters
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();
        final ReviewService.ReviewStats stats = reviewService.stats();

        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", databaseHealthy ? "ready" : "not_ready");
        status.put("database", databaseHealthy ? "connected" : "disconnected");
        status.put("reviews", stats.reviews());
        status.put("total_cost", stats.totalCost());

        if (databaseHealthy) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (final SQLException e) {
            LOG.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

}
