package co.fanki.codereview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Code Review Server Application.
 *
 * <p>Reviews batches of source files by running several producers over
 * each file through a cached, fault tolerant provider gateway and merging
 * their findings into one ranked report with a recommendation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class CodeReviewServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeReviewServerApplication.class, args);
    }

}
