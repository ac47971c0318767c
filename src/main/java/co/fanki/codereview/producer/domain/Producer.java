package co.fanki.codereview.producer.domain;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.ReviewOptions;

/**
 * An independent reviewer that turns one file into findings.
 *
 * <p>Implementations never throw for ordinary failures: they return a
 * failed {@link ProducerOutcome}. They only throw when the calling thread
 * was interrupted, so that cancellation is not mistaken for a result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Producer {

    /**
     * Returns the producer name, reported as a finding source.
     *
     * @return the name
     */
    String name();

    /**
     * Checks whether the review options enable this producer.
     *
     * @param options the review options
     * @return true to run it
     */
    boolean enabledBy(ReviewOptions options);

    /**
     * Reviews one file.
     *
     * @param unit the file
     * @param context what the earlier stages found
     * @return the outcome, never null
     */
    ProducerOutcome produce(CodeUnit unit, ReviewContext context);

}
