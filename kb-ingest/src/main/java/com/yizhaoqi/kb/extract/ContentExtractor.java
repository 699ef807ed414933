package com.yizhaoqi.kb.extract;

import com.yizhaoqi.kb.entity.ExtractedContent;
import com.yizhaoqi.kb.entity.ExtractionError;
import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import com.yizhaoqi.kb.entity.ExtractionOutcome;
import com.yizhaoqi.kb.exception.ExtractionException;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.storage.BlobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a document's source into plain text plus metadata, choosing the strategy by declared file type
 * (or by the response content type for URL documents). Never returns partial content: any strategy
 * failure becomes a failed {@link ExtractionOutcome}.
 */
@Service
public class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    static final String PDF_URL_MESSAGE = "PDF URLs are not yet supported. Please download and upload the file.";

    private final BlobStorage blobStorage;
    private final TikaDocumentParser tikaDocumentParser;
    private final HtmlContentNormalizer htmlContentNormalizer;
    private final JsonTextFlattener jsonTextFlattener;
    private final CsvTextRenderer csvTextRenderer;
    private final UrlContentFetcher urlContentFetcher;

    public ContentExtractor(BlobStorage blobStorage,
                            TikaDocumentParser tikaDocumentParser,
                            HtmlContentNormalizer htmlContentNormalizer,
                            JsonTextFlattener jsonTextFlattener,
                            CsvTextRenderer csvTextRenderer,
                            UrlContentFetcher urlContentFetcher) {
        this.blobStorage = blobStorage;
        this.tikaDocumentParser = tikaDocumentParser;
        this.htmlContentNormalizer = htmlContentNormalizer;
        this.jsonTextFlattener = jsonTextFlattener;
        this.csvTextRenderer = csvTextRenderer;
        this.urlContentFetcher = urlContentFetcher;
    }

    public ExtractionOutcome extract(KnowledgeDocument document) {
        if (document.getSourceType() == DocumentSourceType.URL) {
            return extractFromUrl(document.getSourceUrl());
        }
        byte[] data;
        try {
            data = blobStorage.fetchBytes(document.getFilePath());
        } catch (IOException e) {
            logger.error("Could not read document {} from storage: {}", document.getId(), document.getFilePath(), e);
            return ExtractionOutcome.failure(new ExtractionError(ExtractionFailureKind.SOURCE_UNAVAILABLE,
                    document.getFileType().getExtension(), e.getMessage()));
        }
        return extractFromFile(data, document.getFileType(), document.getName());
    }

    public ExtractionOutcome extractFromFile(byte[] data, DocumentFileType fileType, String fileName) {
        String format = fileType == null ? "unknown" : fileType.getExtension();
        try {
            if (fileType == null) {
                throw new ExtractionException(ExtractionFailureKind.UNSUPPORTED_FILE_TYPE, format,
                        "Unsupported file type: " + format);
            }
            return ExtractionOutcome.success(extractFile(data, fileType, fileName));
        } catch (ExtractionException e) {
            logger.warn("Extraction failed for {} ({}): {}", fileName, format, e.getMessage());
            return ExtractionOutcome.failure(new ExtractionError(e.getKind(), e.getFormat(), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected extraction failure for {} ({})", fileName, format, e);
            return ExtractionOutcome.failure(new ExtractionError(ExtractionFailureKind.PARSE_FAILED, format,
                    String.format("Failed to extract text from %s: %s", format.toUpperCase(), e.getMessage())));
        }
    }

    public ExtractionOutcome extractFromUrl(String url) {
        try {
            UrlContentFetcher.FetchedResource resource = urlContentFetcher.fetch(url);
            if (resource.hasMediaType("text/html")) {
                HtmlContentNormalizer.NormalizedPage page = htmlContentNormalizer.normalize(resource.bodyAsText());
                Map<String, Object> metadata = new LinkedHashMap<>(page.metadata());
                metadata.put("source", url);
                return ExtractionOutcome.success(withMetrics(page.text(), metadata));
            }
            if (resource.hasMediaType("text/plain")) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("source", url);
                return ExtractionOutcome.success(withMetrics(resource.bodyAsText(), metadata));
            }
            if (resource.hasMediaType("application/pdf")) {
                throw new ExtractionException(ExtractionFailureKind.UNSUPPORTED_CONTENT_TYPE, "pdf", PDF_URL_MESSAGE);
            }
            throw new ExtractionException(ExtractionFailureKind.UNSUPPORTED_CONTENT_TYPE, "html",
                    "Unsupported content type: " + resource.contentType());
        } catch (ExtractionException e) {
            logger.warn("URL extraction failed for {}: {}", url, e.getMessage());
            return ExtractionOutcome.failure(new ExtractionError(e.getKind(), e.getFormat(), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure extracting URL {}", url, e);
            return ExtractionOutcome.failure(new ExtractionError(ExtractionFailureKind.FETCH_FAILED, "html",
                    "Failed to fetch URL: " + e.getMessage()));
        }
    }

    private ExtractedContent extractFile(byte[] data, DocumentFileType fileType, String fileName) {
        switch (fileType) {
            case PDF:
            case DOCX:
            case DOC: {
                TikaDocumentParser.ParsedDocument parsed = tikaDocumentParser.parse(data, fileType, fileName);
                return withMetrics(parsed.text(), parsed.metadata());
            }
            case TXT:
            case MD:
                return withMetrics(utf8(data), new LinkedHashMap<>());
            case HTML: {
                HtmlContentNormalizer.NormalizedPage page = htmlContentNormalizer.normalize(utf8(data));
                return withMetrics(page.text(), page.metadata());
            }
            case JSON: {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("structure", "json");
                return withMetrics(jsonTextFlattener.flatten(utf8(data)), metadata);
            }
            case CSV: {
                CsvTextRenderer.RenderedTable table = csvTextRenderer.render(utf8(data));
                return withMetrics(table.text(), table.metadata());
            }
            default:
                throw new ExtractionException(ExtractionFailureKind.UNSUPPORTED_FILE_TYPE, fileType.getExtension(),
                        "Unsupported file type: " + fileType.getExtension());
        }
    }

    private static String utf8(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    private static ExtractedContent withMetrics(String content, Map<String, Object> metadata) {
        String text = content == null ? "" : content;
        Map<String, Object> enriched = new LinkedHashMap<>(metadata);
        enriched.put("wordCount", TextMetrics.wordCount(text));
        enriched.put("characterCount", text.length());
        return new ExtractedContent(text, enriched);
    }
}
