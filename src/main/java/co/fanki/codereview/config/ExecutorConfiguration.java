package co.fanki.codereview.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the review server. The container shuts them down.
 *
 * <p>Producer calls share one bounded pool across all reviews, which caps
 * the concurrent provider requests of the process. Whole reviews run on a
 * separate pool so a review waiting on its producers never holds a
 * producer thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ExecutorConfiguration {

    /**
     * Pool running (file, producer) calls.
     *
     * @param poolSize the maximum concurrent producer calls
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService producerExecutor(
            @Value("${review.producer.pool-size:8}") final int poolSize) {
        return Executors.newFixedThreadPool(poolSize, named("producer"));
    }

    /**
     * Pool running submitted reviews.
     *
     * @param poolSize the maximum concurrent reviews
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService reviewExecutor(
            @Value("${review.pipeline.pool-size:4}") final int poolSize) {
        return Executors.newFixedThreadPool(poolSize, named("review"));
    }

    /**
     * Scheduler pushing server-sent status snapshots.
     *
     * @return the scheduler
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamScheduler() {
        return Executors.newScheduledThreadPool(2, named("review-stream"));
    }

    private static ThreadFactory named(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable,
                    prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

}
