package co.fanki.codeintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Code Intelligence Core application.
 *
 * <p>Hosts the persistence and concurrency core of the code intelligence
 * service: the project call-graph store, the conversation checkpoint store
 * and the background documentation job coordinator. The HTTP layer, the
 * source parser and the vector index plug in as external collaborators.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeIntelApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeIntelApplication.class, args);
    }

}
