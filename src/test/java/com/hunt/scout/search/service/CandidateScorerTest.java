package com.hunt.scout.search.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandidateScorerTest {

    private final CandidateScorer scorer = new CandidateScorer();

    @Test
    void unrelatedHeadlineScoresZero() {
        assertEquals(0.0, scorer.score("marketing manager", "backend engineer"));
    }

    @Test
    void verbatimQueryScoresAtLeastFive() {
        double score = scorer.score("senior backend engineer at google", "backend engineer");

        assertTrue(score >= 5.0);
        // 5 verbatim + 2 * 2 токена + senior + engineer
        assertEquals(11.0, score);
    }

    @Test
    void tokenMatchWithoutVerbatim() {
        assertEquals(3.0, scorer.score("backend developer", "backend engineer"));
    }

    @Test
    void seniorityAndRoleTermsCountWithoutQueryMatch() {
        assertEquals(2.0, scorer.score("principal architect", "data scientist"));
        assertEquals(1.0, scorer.score("team lead", "recruiter"));
    }

    @Test
    void blankOrNullHeadlineScoresZero() {
        assertEquals(0.0, scorer.score(null, "backend engineer"));
        assertEquals(0.0, scorer.score("", "backend engineer"));
        assertEquals(0.0, scorer.score("   ", "backend engineer"));
    }

    @Test
    void blankQueryStillCountsMarkers() {
        assertEquals(2.0, scorer.score("senior engineer", ""));
        assertEquals(2.0, scorer.score("senior engineer", null));
    }

    @Test
    void scoreIsDeterministic() {
        String headline = "staff software engineer | distributed systems";
        assertEquals(scorer.score(headline, "software engineer"), scorer.score(headline, "software engineer"));
    }
}
