package co.fanki.codereview.producer.domain;

import co.fanki.codereview.provider.domain.CostLedger;
import co.fanki.codereview.provider.domain.ModelProvider;
import co.fanki.codereview.provider.domain.PricingTable;
import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.domain.ReviewOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ProducerCatalog}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProducerCatalogTest {

    private ProviderGateway gateway;

    private FindingParser parser;

    @BeforeEach
    void setUp() {
        gateway = new ProviderGateway(createMock(ModelProvider.class), null,
                PricingTable.defaults(), new CostLedger());
        parser = new FindingParser();
    }

    @Test
    void whenFiltering_givenDefaults_shouldEnableAllInOrder() {
        final List<String> names = catalog().enabledFor(ReviewOptions.defaults())
                .stream().map(Producer::name).toList();

        assertEquals(List.of("analyzer", "security", "optimizer", "documenter"),
                names);
    }

    @Test
    void whenFiltering_givenOptionalProducersDisabled_shouldKeepAnalyzer() {
        final List<String> names = catalog().enabledFor(
                new ReviewOptions(false, false, false))
                .stream().map(Producer::name).toList();

        assertEquals(List.of("analyzer"), names);
    }

    @Test
    void whenCreating_givenDuplicateNames_shouldThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new ProducerCatalog(
                List.of(new AnalyzerProducer(gateway, parser, 0.7, false),
                        new AnalyzerProducer(gateway, parser, 0.7, false))));
    }

    private ProducerCatalog catalog() {
        return new ProducerCatalog(List.of(
                new AnalyzerProducer(gateway, parser, 0.7, false),
                new SecurityProducer(gateway, parser, 0.7, false),
                new OptimizerProducer(gateway, parser, 0.7, false),
                new DocumenterProducer(gateway, parser, 0.7, false)));
    }

}
