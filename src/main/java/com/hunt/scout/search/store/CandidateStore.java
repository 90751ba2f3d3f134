package com.hunt.scout.search.store;

import com.hunt.scout.search.dto.Candidate;

import java.util.List;

/**
 * Куда уходит итог поиска. Вызывается один раз за поиск.
 */
public interface CandidateStore {

    void store(List<Candidate> candidates);
}
