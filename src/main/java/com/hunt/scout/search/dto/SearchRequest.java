package com.hunt.scout.search.dto;

import lombok.Builder;

@Builder(toBuilder = true)
public record SearchRequest(
        String query,
        String location,
        int pageLimit,
        double minScore,
        int targetCount
) {

    public static final int DEFAULT_PAGE_LIMIT = 3;
    public static final double DEFAULT_MIN_SCORE = 3.0;
    public static final int DEFAULT_TARGET_COUNT = 10;

    public static SearchRequest of(String query, String location) {
        return new SearchRequest(query, location, DEFAULT_PAGE_LIMIT, DEFAULT_MIN_SCORE, DEFAULT_TARGET_COUNT);
    }
}
