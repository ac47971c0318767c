package co.fanki.codereview.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.spi.JdbiPlugin;
import org.jdbi.v3.jackson2.Jackson2Config;
import org.jdbi.v3.jackson2.Jackson2Plugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Jdbi on the Spring data source, backing the result store and the
 * knowledge store.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DatabaseConfiguration {

    /**
     * Creates the Jdbi instance.
     *
     * @param dataSource the data source
     * @param plugins the plugins to install
     * @param objectMapper the mapper used for JSON columns
     * @return the Jdbi instance
     */
    @Bean
    public Jdbi jdbi(
            final DataSource dataSource,
            final List<JdbiPlugin> plugins,
            final ObjectMapper objectMapper) {

        final Jdbi jdbi = Jdbi.create(dataSource);
        plugins.forEach(jdbi::installPlugin);
        jdbi.getConfig(Jackson2Config.class).setMapper(objectMapper);
        return jdbi;
    }

    @Bean
    public JdbiPlugin postgresPlugin() {
        return new PostgresPlugin();
    }

    @Bean
    public JdbiPlugin sqlObjectPlugin() {
        return new SqlObjectPlugin();
    }

    @Bean
    public JdbiPlugin jackson2Plugin() {
        return new Jackson2Plugin();
    }

}
