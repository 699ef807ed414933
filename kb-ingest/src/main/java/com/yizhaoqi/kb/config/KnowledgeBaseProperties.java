package com.yizhaoqi.kb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;


@Component
@ConfigurationProperties(prefix = "knowledge-base")
@Data
public class KnowledgeBaseProperties {

    private Defaults defaults = new Defaults();
    private Search search = new Search();
    private Extraction extraction = new Extraction();

    @Data
    public static class Defaults {

        private String embeddingProvider = "openai";

        private String embeddingModel = "text-embedding-3-small";

        private Integer embeddingDimensions = 1536;

        private Integer chunkSize = 1000;

        private Integer chunkOverlap = 200;
    }

    @Data
    public static class Search {

        private Integer defaultTopK = 5;

        private Double defaultSimilarityThreshold = 0.7;

        private Integer maxTopK = 100;
    }

    @Data
    public static class Extraction {

        private Integer urlTimeoutMillis = 30000;

        private Integer maxRedirects = 5;

        private String userAgent = "Mozilla/5.0 (Knowledge Base Bot)";

        private Long maxUrlBytes = 20L * 1024 * 1024;

        private Integer jsonMaxDepth = 10;
    }
}
