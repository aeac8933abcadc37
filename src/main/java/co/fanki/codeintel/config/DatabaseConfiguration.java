package co.fanki.codeintel.config;

import org.jdbi.v3.core.Jdbi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Database configuration for JDBI3 over embedded SQLite files.
 *
 * <p>The graph and checkpoint stores live in independent database files,
 * each with its own JDBI instance and Flyway migration set.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DatabaseConfiguration {

    /**
     * Creates the JDBI instance of the project graph database.
     *
     * @param properties the application properties
     * @return the graph JDBI instance
     */
    @Bean
    public Jdbi graphJdbi(final CodeIntelProperties properties) {
        return SqliteDatabases.open(properties.storage().graphDb(),
                SqliteDatabases.GRAPH_MIGRATIONS);
    }

    /**
     * Creates the JDBI instance of the conversation checkpoint database.
     *
     * @param properties the application properties
     * @return the checkpoint JDBI instance
     */
    @Bean
    public Jdbi checkpointJdbi(final CodeIntelProperties properties) {
        return SqliteDatabases.open(properties.storage().checkpointDb(),
                SqliteDatabases.CHECKPOINT_MIGRATIONS);
    }

}
