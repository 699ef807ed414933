package com.yizhaoqi.kb.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentSourceType {

    FILE,
    URL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
