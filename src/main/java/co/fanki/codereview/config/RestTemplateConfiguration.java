package co.fanki.codereview.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used by the fallback provider and the GitHub client.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class RestTemplateConfiguration {

    @Bean
    public RestTemplate restTemplate(final RestTemplateBuilder builder,
            @Value("${http.connect-timeout:10s}") final Duration connectTimeout,
            @Value("${http.read-timeout:120s}") final Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

}
