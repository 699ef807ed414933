package com.yizhaoqi.kb.extract;

import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import com.yizhaoqi.kb.exception.ExtractionException;
import com.yizhaoqi.kb.model.DocumentFileType;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Office and PDF text extraction through Tika's auto-detecting parser.
 */
@Component
public class TikaDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(TikaDocumentParser.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    public ParsedDocument parse(byte[] data, DocumentFileType fileType, String fileName) {
        String label = fileType == DocumentFileType.PDF ? "PDF" : fileType.getExtension().toUpperCase();
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = new Metadata();
        if (fileName != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
        }

        try (InputStream stream = new ByteArrayInputStream(data)) {
            parser.parse(stream, handler, metadata, new ParseContext());
        } catch (IOException | SAXException | TikaException e) {
            logger.error("Tika failed to parse {} document {}", label, fileName, e);
            throw new ExtractionException(ExtractionFailureKind.PARSE_FAILED, fileType.getExtension(),
                    String.format("Failed to extract text from %s: %s", label, e.getMessage()), e);
        }

        Map<String, Object> extracted = new LinkedHashMap<>();
        if (fileType == DocumentFileType.PDF) {
            Integer pages = metadata.getInt(PagedText.N_PAGES);
            extracted.put("pages", pages != null ? pages : 0);
            putIfPresent(extracted, "author", metadata.get(TikaCoreProperties.CREATOR));
            putIfPresent(extracted, "title", metadata.get(TikaCoreProperties.TITLE));
            putIfPresent(extracted, "language", metadata.get(TikaCoreProperties.LANGUAGE));
        } else {
            String[] warnings = metadata.getValues(TikaCoreProperties.TIKA_META_EXCEPTION_WARNING);
            extracted.put("warnings", Arrays.asList(warnings));
        }
        logger.debug("Parsed {} document {}: {} characters", label, fileName, handler.toString().length());
        return new ParsedDocument(handler.toString(), extracted);
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.trim().isEmpty()) {
            target.put(key, value.trim());
        }
    }

    public record ParsedDocument(String text, Map<String, Object> metadata) {
    }
}
