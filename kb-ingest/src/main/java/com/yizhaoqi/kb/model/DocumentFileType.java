package com.yizhaoqi.kb.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * File formats accepted for ingestion. Anything else is rejected when the document is created.
 */
public enum DocumentFileType {

    PDF("pdf"),
    DOCX("docx"),
    DOC("doc"),
    TXT("txt"),
    MD("md"),
    HTML("html"),
    JSON("json"),
    CSV("csv");

    private final String extension;

    DocumentFileType(String extension) {
        this.extension = extension;
    }

    @JsonValue
    public String getExtension() {
        return extension;
    }

    public static Optional<DocumentFileType> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (DocumentFileType type : values()) {
            if (type.extension.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static String extensionOf(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return "";
        }
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(lastDotIndex + 1).toLowerCase();
    }

    public static String supportedExtensions() {
        return Arrays.stream(values())
                .map(DocumentFileType::getExtension)
                .collect(Collectors.joining(", "));
    }
}
