package com.hunt.scout.search.store;

import com.hunt.scout.search.dto.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Держит результат последнего поиска в памяти, для следующих шагов (извлечение профилей, оценка).
 * На диск ничего не пишет.
 */
@Slf4j
@Component
public class InMemoryCandidateStore implements CandidateStore {

    private final AtomicReference<Snapshot> latest = new AtomicReference<>(new Snapshot(List.of(), null));

    @Override
    public void store(List<Candidate> candidates) {
        List<Candidate> copy = candidates == null ? List.of() : List.copyOf(candidates);
        latest.set(new Snapshot(copy, Instant.now()));
        log.info("Stored {} search results", copy.size());
    }

    public List<Candidate> getLatest() {
        return latest.get().candidates();
    }

    /** null пока ничего не сохраняли */
    public Instant getStoredAt() {
        return latest.get().storedAt();
    }

    public void clear() {
        latest.set(new Snapshot(List.of(), null));
    }

    private record Snapshot(List<Candidate> candidates, Instant storedAt) {}
}
