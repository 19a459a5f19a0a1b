package de.mirkosertic.searchvalidator.embedding;

import de.mirkosertic.searchvalidator.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported embedding model identifiers and their output dimensions.
 */
public enum EmbeddingModel {

    BGM_M3("bgm-m3", 1024),
    OPENAI("openai", 1536);

    private final String id;
    private final int dimension;

    EmbeddingModel(final String id, final int dimension) {
        this.id = id;
        this.dimension = dimension;
    }

    public String getId() {
        return id;
    }

    public int getDimension() {
        return dimension;
    }

    public static EmbeddingModel fromId(final String id) {
        final String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (final EmbeddingModel model : values()) {
            if (model.id.equals(normalized)) {
                return model;
            }
        }
        throw new ConfigurationException("Unsupported embedding model '" + id + "', expected one of "
                + Arrays.stream(values()).map(EmbeddingModel::getId).collect(Collectors.joining(", ")));
    }
}
