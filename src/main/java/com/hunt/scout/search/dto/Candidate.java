package com.hunt.scout.search.dto;

import lombok.Builder;

/**
 * Одна карточка из выдачи поиска. Идентичность только по profileUrl (точное сравнение строк).
 */
@Builder
public record Candidate(
        String name,
        String headline,
        String profileUrl
) {}
