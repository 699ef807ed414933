package com.yizhaoqi.kb.entity;

import java.util.List;

public record SearchResponse(String query, List<SearchResult> results, int count) {

    public static SearchResponse of(String query, List<SearchResult> results) {
        return new SearchResponse(query, results, results.size());
    }
}
