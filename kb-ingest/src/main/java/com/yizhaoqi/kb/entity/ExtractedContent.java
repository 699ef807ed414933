package com.yizhaoqi.kb.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized text of a source document and what was learned while extracting it
 * (page count, word count, title, warnings, ...).
 */
public class ExtractedContent {

    private final String content;
    private final Map<String, Object> metadata;

    public ExtractedContent(String content, Map<String, Object> metadata) {
        this.content = content;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getContent() {
        return content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Object metadata(String key) {
        return metadata.get(key);
    }
}
