package com.yizhaoqi.kb.extract;

import com.yizhaoqi.kb.config.KnowledgeBaseProperties;
import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import com.yizhaoqi.kb.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Downloads a web resource, following at most the configured number of redirects. The configured
 * timeout bounds the whole fetch: every redirect hop and the full body read share one deadline,
 * checked after each read. Socket timeouts of each hop are capped at the time left when it connects.
 */
@Component
@Slf4j
public class UrlContentFetcher {

    private final KnowledgeBaseProperties properties;

    public UrlContentFetcher(KnowledgeBaseProperties properties) {
        this.properties = properties;
    }

    public FetchedResource fetch(String url) {
        KnowledgeBaseProperties.Extraction config = properties.getExtraction();
        String current = url;
        int redirects = 0;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getUrlTimeoutMillis());
        try {
            while (true) {
                HttpURLConnection connection = open(current, config, remainingMillis(deadline, config));
                try {
                    int status = connection.getResponseCode();
                    if (isRedirect(status)) {
                        String location = connection.getHeaderField("Location");
                        if (location == null) {
                            throw fetchFailed("Redirect without Location header (HTTP " + status + ")", null);
                        }
                        if (++redirects > config.getMaxRedirects()) {
                            throw fetchFailed("Maximum number of redirects exceeded (" + config.getMaxRedirects() + ")", null);
                        }
                        current = URI.create(current).resolve(location).toString();
                        log.debug("Following redirect {} -> {}", url, current);
                        continue;
                    }
                    if (status < 200 || status >= 300) {
                        throw fetchFailed("Request failed with status code " + status, null);
                    }
                    String contentType = connection.getContentType();
                    byte[] body = readBody(connection, config.getMaxUrlBytes(), deadline, config);
                    log.info("Fetched URL {}: status={}, contentType={}, bytes={}", current, status, contentType, body.length);
                    return new FetchedResource(current, contentType == null ? "" : contentType, body);
                } finally {
                    connection.disconnect();
                }
            }
        } catch (ExtractionException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error fetching URL: {}", url, e);
            throw fetchFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private HttpURLConnection open(String url, KnowledgeBaseProperties.Extraction config, int timeoutMillis)
            throws IOException {
        URL target = URI.create(url).toURL();
        HttpURLConnection connection = (HttpURLConnection) target.openConnection();
        connection.setRequestMethod("GET");
        connection.setInstanceFollowRedirects(false);
        connection.setConnectTimeout(timeoutMillis);
        connection.setReadTimeout(timeoutMillis);
        connection.setRequestProperty("User-Agent", config.getUserAgent());
        return connection;
    }

    private static boolean isRedirect(int status) {
        return status == HttpURLConnection.HTTP_MOVED_PERM
                || status == HttpURLConnection.HTTP_MOVED_TEMP
                || status == HttpURLConnection.HTTP_SEE_OTHER
                || status == 307
                || status == 308;
    }

    private byte[] readBody(HttpURLConnection connection, long maxBytes, long deadline,
                            KnowledgeBaseProperties.Extraction config) throws IOException {
        int limit = (int) Math.min(Integer.MAX_VALUE - 8, maxBytes);
        try (InputStream in = connection.getInputStream()) {
            ByteArrayOutputStream body = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                body.write(buffer, 0, read);
                if (body.size() > limit) {
                    throw new IOException("Response body exceeds " + limit + " bytes");
                }
                remainingMillis(deadline, config);
            }
            return body.toByteArray();
        }
    }

    /**
     * Milliseconds left before the deadline, at least 1 so it is never read as "no timeout".
     *
     * @throws ExtractionException once the deadline has passed
     */
    private static int remainingMillis(long deadline, KnowledgeBaseProperties.Extraction config) {
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remaining <= 0) {
            throw fetchFailed("timed out after " + config.getUrlTimeoutMillis() + " ms", null);
        }
        return (int) Math.min(Integer.MAX_VALUE, remaining);
    }

    private static ExtractionException fetchFailed(String cause, Throwable error) {
        return new ExtractionException(ExtractionFailureKind.FETCH_FAILED, "html",
                "Failed to fetch URL: " + cause, error);
    }

    /**
     * A downloaded resource. {@code contentType} is the raw header value, empty when the server sent none.
     */
    public record FetchedResource(String finalUrl, String contentType, byte[] body) {

        public boolean hasMediaType(String mediaType) {
            return contentType.toLowerCase().contains(mediaType);
        }

        public String bodyAsText() {
            return new String(body, charset());
        }

        private Charset charset() {
            for (String param : contentType.split(";")) {
                String trimmed = param.trim();
                if (trimmed.toLowerCase().startsWith("charset=")) {
                    String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                    try {
                        return Charset.forName(name);
                    } catch (IllegalArgumentException e) {
                        return StandardCharsets.UTF_8;
                    }
                }
            }
            return StandardCharsets.UTF_8;
        }
    }
}
