package co.fanki.codereview.producer.domain;

import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.StaticAnalysisResult;
import co.fanki.codereview.provider.domain.CostLedger;
import co.fanki.codereview.provider.domain.ModelProvider;
import co.fanki.codereview.provider.domain.PricingTable;
import co.fanki.codereview.provider.domain.ProviderException;
import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.provider.domain.ProviderResponse;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.ReviewOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SecurityProducer} and the prompting it inherits.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SecurityProducerTest {

    private static final String MODEL = "claude-sonnet-4-20250514";

    private static final CodeUnit UNIT = CodeUnit.of("src/db.py",
            "cursor.execute('SELECT * FROM t WHERE id=' + user_id)", null);

    private static final String TWO_ISSUES = """
            {"reasoning": "r",
             "issues": [
               {"severity": "critical", "category": "security", "line_start": 1,
                "title": "SQL injection", "confidence": 0.9},
               {"severity": "minor", "category": "security", "line_start": 1,
                "title": "Wildcard select", "confidence": 0.5}
             ],
             "overall_quality_score": 30}
            """;

    private ModelProvider provider;

    @BeforeEach
    void setUp() {
        provider = createMock(ModelProvider.class);
        expect(provider.name()).andReturn("claude").anyTimes();
        expect(provider.model()).andReturn(MODEL).anyTimes();
    }

    @Test
    void whenProducing_givenFindingsUnderThreshold_shouldDropThem() {
        expect(provider.complete(anyString(), anyString())).andReturn(
                new ProviderResponse(TWO_ISSUES, MODEL, 1000, 1000));
        replay(provider);

        final ProducerOutcome outcome = producer(false).produce(UNIT,
                ReviewContext.empty());

        assertTrue(outcome.succeeded());
        assertEquals("security", outcome.producerName());
        assertEquals(1, outcome.findings().size());
        assertEquals("SQL injection", outcome.findings().get(0).title());
        assertEquals(30.0, outcome.qualityScore());
        assertEquals(0.018, outcome.cost(), 1e-9);
        verify(provider);
    }

    @Test
    void whenProducing_givenSelfReflection_shouldDropFalsePositivesAndAddCost() {
        expect(provider.complete(anyString(), anyString())).andReturn(
                new ProviderResponse(TWO_ISSUES, MODEL, 1000, 1000));
        expect(provider.complete(anyString(), anyString())).andReturn(
                new ProviderResponse("""
                        {"false_positives": [0],
                         "confidence_adjustments": {"1": 0.85}}
                        """, MODEL, 1000, 0));
        replay(provider);

        final ProducerOutcome outcome = producer(true).produce(UNIT,
                ReviewContext.empty());

        assertEquals(1, outcome.findings().size());
        assertEquals("Wildcard select", outcome.findings().get(0).title());
        assertEquals(0.85, outcome.findings().get(0).confidence());
        assertEquals(0.021, outcome.cost(), 1e-9);
        verify(provider);
    }

    @Test
    void whenProducing_givenProviderFailure_shouldReturnFailedOutcome() {
        expect(provider.complete(anyString(), anyString())).andThrow(
                new ProviderException("claude",
                        ProviderException.Kind.TRANSIENT, "overloaded"));
        replay(provider);

        final ProducerOutcome outcome = producer(false).produce(UNIT,
                ReviewContext.empty());

        assertFalse(outcome.succeeded());
        assertTrue(outcome.error().contains("overloaded"));
        assertTrue(outcome.findings().isEmpty());
        verify(provider);
    }

    @Test
    void whenBuildingPrompt_givenContext_shouldIncludeStaticIssuesAndPractices() {
        replay(provider);
        final ReviewContext context = new ReviewContext(
                StaticAnalysisResult.of("line-metrics", List.of(
                        new StaticAnalysisResult.StaticIssue(1,
                                "hardcoded-secret", "Possible credential"))),
                List.of(new KnowledgeSnippet("Python: parameterized SQL",
                        "Pass parameters to the driver", "python", 0.5)));

        final String prompt = producer(false).userPrompt(UNIT, context);

        assertTrue(prompt.contains("src/db.py"));
        assertTrue(prompt.contains("security vulnerabilities"));
        assertTrue(prompt.contains("[hardcoded-secret] Possible credential"));
        assertTrue(prompt.contains("Python: parameterized SQL"));
    }

    @Test
    void whenCheckingOptions_givenSecurityDisabled_shouldNotRun() {
        replay(provider);

        assertFalse(producer(false).enabledBy(
                new ReviewOptions(false, true, true)));
        assertTrue(producer(false).enabledBy(ReviewOptions.defaults()));
    }

    private SecurityProducer producer(final boolean selfReflection) {
        final ProviderGateway gateway = new ProviderGateway(provider, null,
                PricingTable.defaults(), new CostLedger());
        return new SecurityProducer(gateway, new FindingParser(), 0.7,
                selfReflection);
    }

}
