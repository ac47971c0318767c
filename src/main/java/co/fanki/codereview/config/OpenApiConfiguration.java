package co.fanki.codereview.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Code Review Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI document.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Code Review Server API")
                        .description("""
                                Code Review Server - runs submitted files through static checks,
                                knowledge enrichment and several model-backed reviewers, then merges
                                their findings into one scored report.

                                ## Features
                                - **Reviews**: submit a batch, poll or stream its progress
                                - **Pull requests**: review a GitHub pull request and post the summary
                                - **Caching**: unchanged files are not sent to a model twice

                                ## MCP Tools
                                - `submit_review` - Start a review
                                - `get_review_status` - Poll a review
                                - `delete_review` - Cancel and drop a review
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
