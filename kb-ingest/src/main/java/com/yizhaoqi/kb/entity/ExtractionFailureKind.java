package com.yizhaoqi.kb.entity;

public enum ExtractionFailureKind {
    UNSUPPORTED_FILE_TYPE,
    UNSUPPORTED_CONTENT_TYPE,
    SOURCE_UNAVAILABLE,
    FETCH_FAILED,
    PARSE_FAILED
}
