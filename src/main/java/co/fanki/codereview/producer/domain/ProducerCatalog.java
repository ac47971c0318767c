package co.fanki.codereview.producer.domain;

import co.fanki.codereview.review.domain.ReviewOptions;
import co.fanki.codereview.shared.Preconditions;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The registered producers, in the order their outcomes are reported.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProducerCatalog {

    private final List<Producer> producers;

    /**
     * Creates the catalog.
     *
     * @param theProducers the producers, names must be unique
     */
    public ProducerCatalog(final List<Producer> theProducers) {
        Preconditions.requireNonNull(theProducers, "Producers are required");
        final Set<String> names = new HashSet<>();
        for (Producer producer : theProducers) {
            Preconditions.require(names.add(producer.name()),
                    "Duplicate producer name: " + producer.name());
        }
        this.producers = List.copyOf(theProducers);
    }

    /**
     * Returns the producers the options enable.
     *
     * @param options the review options
     * @return the enabled producers, in catalog order
     */
    public List<Producer> enabledFor(final ReviewOptions options) {
        return producers.stream()
                .filter(producer -> producer.enabledBy(options))
                .toList();
    }

    public List<Producer> all() {
        return producers;
    }

}
