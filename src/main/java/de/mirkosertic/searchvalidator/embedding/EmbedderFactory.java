package de.mirkosertic.searchvalidator.embedding;

import de.mirkosertic.searchvalidator.config.ApplicationConfig;
import de.mirkosertic.searchvalidator.config.ConfigurationException;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the {@link Embedder} implementation for the configured model identifier.
 */
public final class EmbedderFactory {

    private static final Logger logger = LoggerFactory.getLogger(EmbedderFactory.class);

    private EmbedderFactory() {
    }

    public static Embedder create(final ApplicationConfig config, final JsonHttpClient httpClient) {
        final EmbeddingModel model = EmbeddingModel.fromId(config.getEmbeddingModel());
        final Embedder embedder = switch (model) {
            case BGM_M3 -> new SelfHostedEmbedder(
                    httpClient,
                    config.getBgmM3Url(),
                    config.getBgmM3Port(),
                    config.getBgmM3Endpoint(),
                    config.getExpectedVectorSize());
            case OPENAI -> {
                if (config.getOpenAiApiKey() == null) {
                    throw new ConfigurationException("Embedding model 'openai' requires OPENAI_API_KEY");
                }
                yield new OpenAiEmbedder(
                        httpClient,
                        config.getOpenAiBaseUrl(),
                        config.getOpenAiApiKey(),
                        config.getOpenAiModelName(),
                        config.getExpectedVectorSize());
            }
        };
        logger.info("Using embedding model {} ({} dimensions)", embedder.modelName(), embedder.dimension());
        return embedder;
    }
}
