package com.yizhaoqi.kb.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yizhaoqi.kb.exception.EmbeddingProviderException;
import com.yizhaoqi.kb.model.EmbeddingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;


/**
 * OpenAI-compatible {@code /embeddings} client. Texts are sent in batches; rate limits, 5xx answers
 * and timeouts are retried with a fixed delay, everything else fails the call immediately.
 */
@Component
public class EmbeddingClient implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingClient.class);

    @Value("${embedding.api.batch-size:100}")
    private int batchSize;

    @Value("${embedding.api.max-retries:3}")
    private int maxRetries;

    @Value("${embedding.api.retry-delay-ms:1000}")
    private long retryDelayMillis;

    @Value("${embedding.api.timeout-ms:30000}")
    private long timeoutMillis;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public EmbeddingClient(WebClient embeddingWebClient, ObjectMapper objectMapper) {
        this.webClient = embeddingWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<float[]> embed(List<String> texts, EmbeddingConfig config) {
        if (texts.isEmpty()) {
            return new ArrayList<>();
        }
        logger.info("Starting embedding generation, texts={}, model={}, dimensions={}",
                texts.size(), config.getModel(), config.getDimensions());

        List<float[]> all = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, texts.size());
            List<String> batch = texts.subList(start, end);
            logger.debug("Calling embedding API, batch range: {}-{} (size={})", start, end - 1, batch.size());
            String response = callApiOnce(batch, config);
            all.addAll(parseVectors(response, batch.size(), config.getDimensions()));
        }
        logger.info("Generated {} embeddings", all.size());
        return all;
    }

    private String callApiOnce(List<String> batch, EmbeddingConfig config) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", config.getModel());
        requestBody.put("input", batch);
        requestBody.put("dimensions", config.getDimensions());
        requestBody.put("encoding_format", "float");

        try {
            return webClient.post()
                    .uri("/embeddings")
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMillis))
                    .retryWhen(Retry.fixedDelay(maxRetries, Duration.ofMillis(retryDelayMillis))
                            .filter(EmbeddingClient::isTransient)
                            .doBeforeRetry(signal -> logger.warn("Embedding call failed, retry {}/{}: {}",
                                    signal.totalRetries() + 1, maxRetries, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((backoff, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e));
        }
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return error instanceof TimeoutException || error instanceof WebClientRequestException;
    }

    private EmbeddingProviderException translate(Throwable error) {
        if (error instanceof EmbeddingProviderException providerException) {
            return providerException;
        }
        if (error instanceof WebClientResponseException responseException) {
            String message = String.format("Embedding provider returned %d: %s",
                    responseException.getStatusCode().value(), responseException.getResponseBodyAsString());
            return isTransient(error)
                    ? EmbeddingProviderException.transientFailure(message, error)
                    : EmbeddingProviderException.permanent(message, error);
        }
        if (isTransient(error)) {
            return EmbeddingProviderException.transientFailure(
                    "Embedding provider unavailable: " + describe(error), error);
        }
        return EmbeddingProviderException.permanent("Embedding call failed: " + describe(error), error);
    }

    private List<float[]> parseVectors(String response, int expectedCount, int expectedDimensions) {
        JsonNode data;
        try {
            data = objectMapper.readTree(response).get("data");
        } catch (Exception e) {
            throw EmbeddingProviderException.permanent("Embedding response is not valid JSON", e);
        }
        if (data == null || !data.isArray()) {
            throw EmbeddingProviderException.permanent("Embedding response format error: data field is missing or not an array");
        }
        if (data.size() != expectedCount) {
            throw EmbeddingProviderException.permanent(String.format(
                    "Embedding provider returned %d vectors for %d inputs", data.size(), expectedCount));
        }

        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt(0)));

        List<float[]> vectors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonNode embedding = item.get("embedding");
            if (embedding == null || !embedding.isArray()) {
                throw EmbeddingProviderException.permanent("Embedding response item has no embedding array");
            }
            if (embedding.size() != expectedDimensions) {
                throw EmbeddingProviderException.permanent(String.format(
                        "Embedding dimension mismatch: expected %d, got %d", expectedDimensions, embedding.size()));
            }
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < embedding.size(); i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
