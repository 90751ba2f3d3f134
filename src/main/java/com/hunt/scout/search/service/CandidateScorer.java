package com.hunt.scout.search.service;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Быстрая эвристика релевантности заголовка запросу. Чистая функция, без обращения к браузеру.
 */
@Component
public class CandidateScorer {

    static final double EXACT_QUERY_MATCH = 5.0;
    static final double QUERY_TOKEN_MATCH = 2.0;
    static final double SENIORITY_BONUS = 1.0;
    static final double ROLE_TERM_BONUS = 1.0;

    static final List<String> SENIORITY_MARKERS = List.of("senior", "staff", "principal", "lead");
    static final List<String> ROLE_TERMS = List.of("engineer", "architect", "developer");

    /**
     * Регистр приводит вызывающий. Результат всегда &gt;= 0.
     *
     * @param headlineLower заголовок профиля в нижнем регистре
     * @param queryLower    запрос в нижнем регистре
     */
    public double score(String headlineLower, String queryLower) {
        if (headlineLower == null || headlineLower.isBlank()) return 0.0;

        double score = 0.0;

        if (queryLower != null && !queryLower.isBlank()) {
            String query = queryLower.trim();
            if (headlineLower.contains(query)) {
                score += EXACT_QUERY_MATCH;
            }
            for (String token : query.split("\\s+")) {
                if (!token.isEmpty() && headlineLower.contains(token)) {
                    score += QUERY_TOKEN_MATCH;
                }
            }
        }

        for (String marker : SENIORITY_MARKERS) {
            if (headlineLower.contains(marker)) score += SENIORITY_BONUS;
        }
        for (String term : ROLE_TERMS) {
            if (headlineLower.contains(term)) score += ROLE_TERM_BONUS;
        }

        return score;
    }
}
