package co.fanki.codeintel.job.application;

import co.fanki.codeintel.job.domain.JavadocWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Claude backed {@link JavadocWriter} when an API key is
 * configured.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class JavadocWriterConfiguration {

    @Bean
    @ConditionalOnExpression("!'${claude.api-key:}'.isBlank()")
    public JavadocWriter claudeJavadocWriter(
            @Value("${claude.api-key}") final String apiKey,
            @Value("${claude.model:claude-sonnet-4-5-20250929}")
            final String model) {
        return new ClaudeJavadocWriter(apiKey, model);
    }

}
