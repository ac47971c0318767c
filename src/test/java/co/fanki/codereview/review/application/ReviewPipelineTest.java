package co.fanki.codereview.review.application;

import co.fanki.codereview.cache.application.CacheGate;
import co.fanki.codereview.cache.domain.InMemoryResultCache;
import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.KnowledgeStore;
import co.fanki.codereview.context.domain.LineMetricsStaticAnalyzer;
import co.fanki.codereview.context.domain.StaticAnalysisResult;
import co.fanki.codereview.context.domain.StaticAnalyzer;
import co.fanki.codereview.producer.domain.Producer;
import co.fanki.codereview.producer.domain.ProducerCatalog;
import co.fanki.codereview.producer.domain.ReviewContext;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.Consolidator;
import co.fanki.codereview.review.domain.Finding;
import co.fanki.codereview.review.domain.IssueCategory;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.Recommendation;
import co.fanki.codereview.review.domain.ReviewCancelledException;
import co.fanki.codereview.review.domain.ReviewOptions;
import co.fanki.codereview.review.domain.ReviewRun;
import co.fanki.codereview.review.domain.ReviewStage;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReviewPipeline}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReviewPipelineTest {

    private static final CodeUnit APP = CodeUnit.of("src/app.py",
            "def handler(request):\n    return request.args['q']\n", null);

    private static final CodeUnit DB = CodeUnit.of("src/db.py",
            "cursor.execute('SELECT * FROM t WHERE id=' + uid)\n", null);

    private ExecutorService executor;

    private ReviewRegistry registry;

    private CacheGate cacheGate;

    private StaticAnalyzer staticAnalyzer;

    private KnowledgeStore knowledgeStore;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        registry = new ReviewRegistry();
        cacheGate = new CacheGate(new InMemoryResultCache(Clock.systemUTC()),
                new ObjectMapper(), Duration.ofHours(1), true);
        staticAnalyzer = new LineMetricsStaticAnalyzer(120);
        knowledgeStore = (query, language, topK) -> List.of(
                new KnowledgeSnippet("Validate inputs", "Check input", "any", 0.1));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void whenRunning_givenHealthyProducers_shouldCompleteWithConsolidatedReport() {
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30),
                new StubProducer("analyzer", unit -> ok("analyzer", unit,
                        Severity.MINOR, "Missing docstring", 0.01)),
                new StubProducer("security", unit -> ok("security", unit,
                        Severity.MAJOR, "Unvalidated input", 0.02)));

        final ReviewStatus status = pipeline.run(register(APP, DB));

        assertEquals(ReviewStage.COMPLETE, status.stage());
        assertEquals(100, status.progress());
        assertNotNull(status.completedAt());
        assertEquals(List.of("src/app.py", "src/db.py"), status.result().files());
        // the same title on the same line of both files is one issue
        assertEquals(2, status.result().statistics().totalIssues());
        assertEquals(0.06, status.result().statistics().totalCost(), 1e-9);
        assertEquals(List.of("analyzer", "security"),
                status.result().metadata().producers());
        assertEquals(Recommendation.APPROVE,
                status.result().recommendation());
        assertEquals(93, status.result().score());
        assertEquals(Severity.MAJOR, status.result().issues().get(0).severity());
    }

    @Test
    void whenRunning_givenOneProducerFailingEverywhere_shouldCompleteWithOthers() {
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30),
                new StubProducer("analyzer", unit -> ok("analyzer", unit,
                        Severity.MINOR, "Missing docstring", 0.01)),
                new StubProducer("security",
                        unit -> ProducerOutcome.failed("security", "rate limited", 3)),
                new StubProducer("optimizer", unit -> ok("optimizer", unit,
                        Severity.INFO, "Cache the query", 0.01)),
                new StubProducer("documenter", unit -> ok("documenter", unit,
                        Severity.INFO, "Add a module docstring", 0.01)));
        final ReviewRun run = register(APP, DB);

        final ReviewStatus status = pipeline.run(run);

        assertEquals(ReviewStage.COMPLETE, status.stage());
        assertEquals(List.of("analyzer", "optimizer", "documenter"),
                status.result().metadata().producers());
        // one title per successful producer, each on line 1 of both files
        assertEquals(3, status.result().statistics().totalIssues());
        assertEquals(3, status.result().issues().size());
        assertEquals(0.06, status.result().statistics().totalCost(), 1e-9);
        assertTrue(status.result().issues().stream()
                .noneMatch(issue -> issue.sources().contains("security")));
        assertEquals(2, run.failures().size());
        assertEquals("security", run.failures().get(0).producer());
        assertEquals("rate limited", run.failures().get(0).error());
    }

    @Test
    void whenRunning_givenEveryPairFailing_shouldFailKeepingProgress() {
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30),
                new StubProducer("analyzer",
                        unit -> ProducerOutcome.failed("analyzer", "bad key", 1)),
                new StubProducer("security",
                        unit -> ProducerOutcome.failed("security", "bad key", 1)));

        final ReviewStatus status = pipeline.run(register(APP));

        assertEquals(ReviewStage.FAILED, status.stage());
        assertNull(status.result());
        assertTrue(status.error().contains("bad key"));
        assertEquals(90, status.progress());
        assertEquals(status, registry.get(status.reviewId()).orElseThrow());
    }

    @Test
    void whenRunning_givenFailingContextStages_shouldStillComplete() {
        staticAnalyzer = new StaticAnalyzer() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public StaticAnalysisResult analyze(final CodeUnit unit) {
                throw new IllegalStateException("linter crashed");
            }
        };
        knowledgeStore = (query, language, topK) -> {
            throw new IllegalStateException("database down");
        };
        final StubProducer analyzer = new StubProducer("analyzer",
                unit -> ok("analyzer", unit, Severity.MINOR, "x", 0.0));
        final ReviewRun run = register(APP);

        final ReviewStatus status = pipeline(Duration.ofSeconds(30), analyzer)
                .run(run);

        assertEquals(ReviewStage.COMPLETE, status.stage());
        assertFalse(run.staticResult(APP.path()).succeeded());
        assertEquals("linter crashed", run.staticResult(APP.path()).error());
        assertTrue(run.knowledge(APP.path()).isEmpty());
        assertFalse(analyzer.lastContext.staticAnalysis().succeeded());
    }

    @Test
    void whenRunning_givenUnchangedFileReviewedTwice_shouldServeSecondFromCache() {
        final StubProducer analyzer = new StubProducer("analyzer",
                unit -> ok("analyzer", unit, Severity.MINOR, "Missing docstring", 0.01));
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30), analyzer);

        final ReviewStatus first = pipeline.run(register(APP));
        final ReviewStatus second = pipeline.run(register(APP));

        assertEquals(1, analyzer.calls.get());
        assertEquals(0.01, first.result().statistics().totalCost(), 1e-9);
        assertEquals(0.0, second.result().statistics().totalCost(), 1e-9);
        assertEquals(first.result().issues().size(),
                second.result().issues().size());
    }

    @Test
    void whenRunning_givenChangedContent_shouldRecompute() {
        final StubProducer analyzer = new StubProducer("analyzer",
                unit -> ok("analyzer", unit, Severity.MINOR, "x", 0.01));
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30), analyzer);

        pipeline.run(register(APP));
        pipeline.run(register(CodeUnit.of(APP.path(), APP.content() + "# v2\n",
                null)));

        assertEquals(2, analyzer.calls.get());
    }

    @Test
    void whenRunning_givenSlowProducer_shouldTimeItOutAndKeepTheOthers() {
        final CountDownLatch never = new CountDownLatch(1);
        final ReviewPipeline pipeline = pipeline(Duration.ofMillis(500),
                new StubProducer("analyzer", unit -> ok("analyzer", unit,
                        Severity.MINOR, "x", 0.0)),
                new StubProducer("security", unit -> {
                    block(never);
                    return ok("security", unit, Severity.MAJOR, "late", 0.0);
                }));
        final ReviewRun run = register(APP);

        final ReviewStatus status = pipeline.run(run);

        assertEquals(ReviewStage.COMPLETE, status.stage());
        assertEquals(List.of("analyzer"), status.result().metadata().producers());
        assertEquals(ReviewPipeline.TIMED_OUT, run.failures().get(0).error());
    }

    @Test
    void whenDeleting_givenRunningReview_shouldCancelAndStopWriting()
            throws Exception {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch never = new CountDownLatch(1);
        final AtomicBoolean interrupted = new AtomicBoolean();
        final ReviewPipeline pipeline = pipeline(Duration.ofSeconds(30),
                new StubProducer("analyzer", unit -> {
                    started.countDown();
                    try {
                        never.await(10, TimeUnit.SECONDS);
                    } catch (final InterruptedException e) {
                        interrupted.set(true);
                        Thread.currentThread().interrupt();
                        throw new ReviewCancelledException(unit.path());
                    }
                    return ok("analyzer", unit, Severity.MINOR, "x", 0.0);
                }));
        final ReviewRun run = register(APP);

        final CompletableFuture<ReviewStatus> result = CompletableFuture
                .supplyAsync(() -> pipeline.run(run));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(registry.delete(run.reviewId()));

        final ReviewStatus last = result.get(5, TimeUnit.SECONDS);

        assertEquals(ReviewStage.PRODUCING, last.stage());
        assertTrue(registry.get(run.reviewId()).isEmpty());
        waitFor(interrupted);
        assertTrue(interrupted.get());
    }

    private ReviewPipeline pipeline(final Duration timeout,
            final Producer... producers) {
        return new ReviewPipeline(registry, staticAnalyzer, knowledgeStore,
                new ProducerCatalog(List.of(producers)), cacheGate,
                new Consolidator(), executor, timeout, 3);
    }

    private ReviewRun register(final CodeUnit... units) {
        final ReviewRun run = ReviewRun.create(List.of(units),
                ReviewOptions.defaults());
        registry.create(run);
        return run;
    }

    private static ProducerOutcome ok(final String producer, final CodeUnit unit,
            final Severity severity, final String title, final double cost) {
        final Finding finding = Finding.reportedBy(producer)
                .severity(severity)
                .category(IssueCategory.BUG)
                .lines(1, null)
                .title(title)
                .description(title + " in " + unit.path())
                .confidence(0.9)
                .metadata("file", unit.path())
                .build();
        return ProducerOutcome.succeeded(producer, List.of(finding),
                "reviewed " + unit.path(), 80.0, 5, cost);
    }

    private static void block(final CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewCancelledException("interrupted");
        }
    }

    private static void waitFor(final AtomicBoolean flag)
            throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 5000;
        while (!flag.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    /** Producer answering from a function, counting its calls. */
    private static final class StubProducer implements Producer {

        private final String name;

        private final Function<CodeUnit, ProducerOutcome> behavior;

        private final AtomicInteger calls = new AtomicInteger();

        private volatile ReviewContext lastContext;

        StubProducer(final String theName,
                final Function<CodeUnit, ProducerOutcome> theBehavior) {
            this.name = theName;
            this.behavior = theBehavior;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean enabledBy(final ReviewOptions options) {
            return true;
        }

        @Override
        public ProducerOutcome produce(final CodeUnit unit,
                final ReviewContext context) {
            calls.incrementAndGet();
            lastContext = context;
            return behavior.apply(unit);
        }
    }

}
