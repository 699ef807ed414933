package com.yizhaoqi.kb.client;

import com.yizhaoqi.kb.model.EmbeddingConfig;

import java.util.List;

/**
 * Turns texts into vectors in the vector space described by an {@link EmbeddingConfig}.
 */
public interface EmbeddingProvider {

    /**
     * Returns exactly one vector per input text, in input order, each of length
     * {@code config.getDimensions()}.
     *
     * @throws com.yizhaoqi.kb.exception.EmbeddingProviderException when the provider fails or
     *         returns vectors of the wrong shape
     */
    List<float[]> embed(List<String> texts, EmbeddingConfig config);
}
