package co.fanki.codereview.review.application;

import co.fanki.codereview.cache.application.CacheGate;
import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.KnowledgeStore;
import co.fanki.codereview.context.domain.StaticAnalysisResult;
import co.fanki.codereview.context.domain.StaticAnalyzer;
import co.fanki.codereview.producer.domain.Producer;
import co.fanki.codereview.producer.domain.ProducerCatalog;
import co.fanki.codereview.producer.domain.ReviewContext;
import co.fanki.codereview.review.domain.CancellationToken;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.Consolidation;
import co.fanki.codereview.review.domain.Consolidator;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.ReviewCancelledException;
import co.fanki.codereview.review.domain.ReviewRun;
import co.fanki.codereview.review.domain.ReviewStage;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.StageFailureException;
import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Drives a review run through its four stages.
 *
 * <p>Stages run in order over the whole batch: static analysis, knowledge
 * enrichment, production and consolidation. Production fans out one task
 * per enabled producer of a file on the producer executor, every task
 * going through the {@link CacheGate}; the next file starts once all of
 * them settled. Every wait is bounded by the run deadline, measured from
 * the start of the run.</p>
 *
 * <p>A failing pair is recorded and the run goes on. The run only fails
 * when every pair failed, or on an unexpected error. When the run is
 * deleted its token is cancelled; the pipeline then stops at the next
 * check and never writes to the registry again.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewPipeline.class);

    static final String TIMED_OUT = "timed out";

    private final ReviewRegistry registry;
    private final StaticAnalyzer staticAnalyzer;
    private final KnowledgeStore knowledgeStore;
    private final ProducerCatalog catalog;
    private final CacheGate cacheGate;
    private final Consolidator consolidator;
    private final ExecutorService producerExecutor;
    private final Duration timeout;
    private final int topK;

    /**
     * Creates the pipeline.
     *
     * @param theRegistry the registry holding the runs
     * @param theStaticAnalyzer stage one collaborator
     * @param theKnowledgeStore stage two collaborator
     * @param theCatalog the producers
     * @param theCacheGate the cache gate in front of the producers
     * @param theConsolidator stage four
     * @param theProducerExecutor the pool running producer calls
     * @param theTimeout the run deadline
     * @param theTopK the number of knowledge snippets per file
     */
    public ReviewPipeline(final ReviewRegistry theRegistry,
            final StaticAnalyzer theStaticAnalyzer,
            final KnowledgeStore theKnowledgeStore,
            final ProducerCatalog theCatalog,
            final CacheGate theCacheGate,
            final Consolidator theConsolidator,
            final ExecutorService theProducerExecutor,
            final Duration theTimeout,
            final int theTopK) {
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Registry is required");
        this.staticAnalyzer = Preconditions.requireNonNull(theStaticAnalyzer,
                "Static analyzer is required");
        this.knowledgeStore = Preconditions.requireNonNull(theKnowledgeStore,
                "Knowledge store is required");
        this.catalog = Preconditions.requireNonNull(theCatalog,
                "Producer catalog is required");
        this.cacheGate = Preconditions.requireNonNull(theCacheGate,
                "Cache gate is required");
        this.consolidator = Preconditions.requireNonNull(theConsolidator,
                "Consolidator is required");
        this.producerExecutor = Preconditions.requireNonNull(
                theProducerExecutor, "Producer executor is required");
        this.timeout = Preconditions.requireNonNull(theTimeout,
                "Timeout is required");
        this.topK = Preconditions.requirePositive(theTopK,
                "top_k must be positive");
    }

    /**
     * Runs a registered review to a terminal stage.
     *
     * <p>Never throws for review errors: they end as a failed run.</p>
     *
     * @param run the pending run, already in the registry
     * @return the last snapshot of the run
     */
    public ReviewStatus run(final ReviewRun run) {
        final String reviewId = run.reviewId();
        final long deadline = System.nanoTime() + timeout.toNanos();
        LOG.info("Starting review {} with {} files", reviewId,
                run.units().size());
        try {
            advance(run, ReviewStage.PREPROCESSING);
            preprocess(run);

            advance(run, ReviewStage.ENRICHING);
            enrich(run);

            advance(run, ReviewStage.PRODUCING);
            produce(run, deadline);

            advance(run, ReviewStage.CONSOLIDATING);
            final Consolidation consolidation = consolidator.consolidate(
                    run.orderedOutcomes());
            mutate(run, r -> r.complete(consolidation));

            LOG.info("Review {} complete: {} issues, score {}, {}, ${}",
                    reviewId, consolidation.findings().size(),
                    consolidation.score(),
                    consolidation.recommendation().wireName(),
                    consolidation.totalCost());

        } catch (final ReviewCancelledException e) {
            LOG.info("Review {} cancelled at stage {}", reviewId,
                    run.stage().wireName());
        } catch (final StageFailureException e) {
            LOG.warn("Review {} failed at {}: {}", reviewId,
                    e.stage().wireName(), e.getMessage());
            failQuietly(run, e.getMessage());
        } catch (final RuntimeException e) {
            LOG.error("Review {} failed unexpectedly", reviewId, e);
            failQuietly(run, e.getMessage());
        }
        return run.snapshot();
    }

    private void preprocess(final ReviewRun run) {
        for (CodeUnit unit : run.units()) {
            StaticAnalysisResult result;
            try {
                result = staticAnalyzer.analyze(unit);
            } catch (final RuntimeException e) {
                LOG.warn("Static analysis failed on {}: {}", unit.path(),
                        e.getMessage());
                result = StaticAnalysisResult.failed(staticAnalyzer.name(),
                        e.getMessage());
            }
            final StaticAnalysisResult recorded = result;
            mutate(run, r -> r.recordStaticResult(unit.path(), recorded));
        }
    }

    private void enrich(final ReviewRun run) {
        for (CodeUnit unit : run.units()) {
            List<KnowledgeSnippet> snippets;
            try {
                snippets = knowledgeStore.query(
                        "best practices for " + unit.language(),
                        unit.language(), topK);
            } catch (final RuntimeException e) {
                LOG.warn("Knowledge query failed for {}: {}", unit.path(),
                        e.getMessage());
                snippets = List.of();
            }
            final List<KnowledgeSnippet> recorded = snippets == null
                    ? List.of() : snippets;
            mutate(run, r -> r.recordKnowledge(unit.path(), recorded));
        }
    }

    private void produce(final ReviewRun run, final long deadline) {
        final List<Producer> producers = catalog.enabledFor(run.options());
        final int planned = producers.size() * run.units().size();
        mutate(run, r -> r.planPairs(planned));

        final Map<String, List<ProducerOutcome>> byProducer =
                new LinkedHashMap<>();
        producers.forEach(p -> byProducer.put(p.name(), new ArrayList<>()));

        int failed = 0;
        String lastError = null;

        for (CodeUnit unit : run.units()) {
            run.cancellationToken().throwIfCancelled();
            cacheGate.invalidateStale(unit);

            final ReviewContext context = new ReviewContext(
                    run.staticResult(unit.path()), run.knowledge(unit.path()));

            final Map<Producer, Future<ProducerOutcome>> tasks =
                    new LinkedHashMap<>();
            for (Producer producer : producers) {
                if (System.nanoTime() - deadline >= 0) {
                    tasks.put(producer, null);
                    continue;
                }
                tasks.put(producer, run.cancellationToken().register(
                        producerExecutor.submit(() -> cacheGate.fetch(unit,
                                producer.name(),
                                () -> producer.produce(unit, context)))));
            }

            for (Map.Entry<Producer, Future<ProducerOutcome>> task
                    : tasks.entrySet()) {
                final String name = task.getKey().name();
                final ProducerOutcome outcome = await(run, name,
                        task.getValue(), deadline);
                if (outcome.succeeded()) {
                    byProducer.get(name).add(outcome);
                } else {
                    failed++;
                    lastError = outcome.error();
                    final String error = outcome.error();
                    mutate(run, r -> r.recordFailure(unit.path(), name, error));
                }
                mutate(run, ReviewRun::pairFinished);
            }
        }

        if (planned > 0 && failed == planned) {
            throw new StageFailureException(ReviewStage.PRODUCING,
                    "All " + planned + " producer calls failed, last error: "
                            + lastError);
        }

        for (Map.Entry<String, List<ProducerOutcome>> entry
                : byProducer.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                final ProducerOutcome aggregated = ProducerOutcome.aggregate(
                        entry.getKey(), entry.getValue());
                mutate(run, r -> r.recordOutcome(aggregated));
            }
        }
    }

    private ProducerOutcome await(final ReviewRun run, final String producer,
            final Future<ProducerOutcome> future, final long deadline) {
        final CancellationToken token = run.cancellationToken();
        if (future == null) {
            return ProducerOutcome.failed(producer, TIMED_OUT, 0L);
        }
        final long start = System.currentTimeMillis();
        try {
            final ProducerOutcome outcome = future.get(
                    Math.max(0L, deadline - System.nanoTime()),
                    TimeUnit.NANOSECONDS);
            return outcome != null ? outcome
                    : ProducerOutcome.failed(producer, "no outcome",
                            System.currentTimeMillis() - start);
        } catch (final TimeoutException e) {
            future.cancel(true);
            LOG.warn("Producer {} timed out on review {}", producer,
                    run.reviewId());
            return ProducerOutcome.failed(producer, TIMED_OUT,
                    System.currentTimeMillis() - start);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new ReviewCancelledException(run.reviewId());
        } catch (final CancellationException e) {
            token.throwIfCancelled();
            return ProducerOutcome.failed(producer, "cancelled",
                    System.currentTimeMillis() - start);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReviewCancelledException) {
                token.throwIfCancelled();
            }
            LOG.warn("Producer {} failed on review {}: {}", producer,
                    run.reviewId(), cause.getMessage());
            return ProducerOutcome.failed(producer, String.valueOf(
                    cause.getMessage()), System.currentTimeMillis() - start);
        } finally {
            token.release(future);
        }
    }

    /**
     * Moves the run to a stage, unless it was cancelled or deleted.
     */
    private void advance(final ReviewRun run, final ReviewStage next) {
        mutate(run, r -> r.moveTo(next));
        LOG.debug("Review {} entered {}", run.reviewId(), next.wireName());
    }

    private void mutate(final ReviewRun run, final Consumer<ReviewRun> mutator) {
        run.cancellationToken().throwIfCancelled();
        if (!registry.update(run.reviewId(), mutator)) {
            throw new ReviewCancelledException(run.reviewId());
        }
    }

    private void failQuietly(final ReviewRun run, final String message) {
        if (run.cancellationToken().isCancelled()) {
            return;
        }
        registry.update(run.reviewId(), r -> {
            if (!r.stage().isTerminal()) {
                r.fail(message);
            }
        });
    }

}
