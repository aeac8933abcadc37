package co.fanki.codeintel.job.application;

import co.fanki.codeintel.job.domain.JavadocWriter;
import co.fanki.codeintel.shared.Preconditions;
import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link JavadocWriter} backed by the Claude API.
 *
 * <p>Uses the official Anthropic Java SDK. Each call sends the declaration
 * signature, kind and source and expects a bare JavaDoc block back.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClaudeJavadocWriter implements JavadocWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClaudeJavadocWriter.class);

    private static final long MAX_TOKENS = 1024L;

    private static final String SYSTEM_PROMPT = """
            You write JavaDoc for Java code. Return ONLY a valid JavaDoc \
            block comment that starts with '/**' and ends with '*/'. \
            No markdown, no extra text.
            For classes, interfaces, enums and records: describe the \
            responsibility, key concepts and invariants.
            For methods and constructors: describe what it does, \
            important edge cases and side effects visible in the code.
            Include @param tags for each parameter and @return when the \
            method is not void. Include @throws only when obvious from \
            the code.
            """;

    private static final String PROMPT_TEMPLATE = """
            Signature: %s

            Type: %s

            Code:

            %s
            """;

    private final AnthropicClient client;

    private final String model;

    /**
     * Creates a new ClaudeJavadocWriter.
     *
     * @param apiKey the Anthropic API key
     * @param theModel the model id
     */
    public ClaudeJavadocWriter(final String apiKey, final String theModel) {
        Preconditions.requireNonBlank(apiKey, "API key is required");
        this.model = Preconditions.requireNonBlank(theModel,
                "Model is required");
        this.client = AnthropicOkHttpClient.builder()
                .apiKey(apiKey)
                .build();
    }

    @Override
    public String write(final String signature, final String memberType,
            final String code) {

        LOG.debug("Requesting JavaDoc for {} {}", memberType, signature);

        final MessageCreateParams params = MessageCreateParams.builder()
                .maxTokens(MAX_TOKENS)
                .system(SYSTEM_PROMPT)
                .addUserMessage(String.format(PROMPT_TEMPLATE, signature,
                        memberType, code))
                .model(model)
                .temperature(0.0)
                .build();

        final Message response = client.messages().create(params);

        return response.content().stream()
                .flatMap(block -> block.text().stream())
                .map(textBlock -> textBlock.text())
                .reduce("", String::concat);
    }

}
