package com.yizhaoqi.kb.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embedding settings shared by every document of a knowledge base.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class EmbeddingConfig {

    @Column(name = "embedding_provider", length = 64, nullable = false)
    private String provider;

    @Column(name = "embedding_model", length = 128, nullable = false)
    private String model;

    @Column(name = "embedding_dimensions", nullable = false)
    private int dimensions;

    @Column(name = "chunk_size", nullable = false)
    private int chunkSize;

    @Column(name = "chunk_overlap", nullable = false)
    private int chunkOverlap;

    /**
     * Whether vectors embedded with the given model and dimension are comparable with vectors of this config.
     */
    public boolean sameVectorSpace(String otherModel, Integer otherDimensions) {
        return model != null && model.equals(otherModel)
                && otherDimensions != null && dimensions == otherDimensions;
    }
}
