package com.hunt.scout.search.service;

import com.hunt.scout.browser.config.CdpCommandException;
import com.hunt.scout.browser.config.api.CdpDomActions;
import com.hunt.scout.browser.config.api.CdpPageApi;
import com.hunt.scout.search.config.SearchProperties;
import com.hunt.scout.search.dto.Candidate;
import com.hunt.scout.search.dto.SearchRequest;
import com.hunt.scout.search.dto.SearchResult;
import com.hunt.scout.search.store.CandidateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Постраничный поиск кандидатов: страница -> ожидание выдачи -> извлечение -> скоринг -> дедуп по profileUrl.
 *
 * <p>Правило ошибок: любая ошибка на первой странице фатальна (значит не работает сама навигация/подключение),
 * на следующих страницах страница просто даёт 0 кандидатов. {@link CdpCommandException} фатален всегда:
 * соединение уже закрыто и следующие страницы упадут так же.</p>
 *
 * <p>Страница без единой карточки значит, что выдача кончилась: дальше не листаем.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmartSearchService {

    private final CdpPageApi pageApi;
    private final CdpDomActions domActions;
    private final CandidateExtractor extractor;
    private final CandidateScorer scorer;
    private final SearchUrlBuilder urlBuilder;
    private final CandidateStore store;
    private final SearchProperties properties;

    public SearchResult smartCandidateSearch(SearchRequest request) {
        return smartCandidateSearch(request.query(), request.location(),
                request.pageLimit(), request.minScore(), request.targetCount());
    }

    public SearchResult smartCandidateSearch(String query, String location, int pageLimit, double minScore, int targetCount) {
        if (query == null || query.isBlank()) {
            return SearchResult.failed("query must not be blank", 0);
        }
        if (pageLimit < 1 || targetCount < 1) {
            return SearchResult.failed("pageLimit and targetCount must be positive (pageLimit="
                    + pageLimit + ", targetCount=" + targetCount + ")", 0);
        }

        log.info("🔍 Searching: '{}' in {}", query, location);

        String queryLower = query.toLowerCase(Locale.ROOT);
        List<Candidate> accepted = new ArrayList<>();
        Set<String> acceptedUrls = new HashSet<>();
        int pagesVisited = 0;

        for (int pageNo = 1; pageNo <= pageLimit && accepted.size() < targetCount; pageNo++) {
            log.info("📖 Searching page {}/{}", pageNo, pageLimit);
            pagesVisited++;

            try {
                List<Candidate> found = visitPage(query, location, pageNo);
                if (found.isEmpty()) {
                    log.info("❌ No results on page {}, stopping search", pageNo);
                    break;
                }
                int kept = accept(found, queryLower, minScore, targetCount, accepted, acceptedUrls);
                log.info("Page {}: {} extracted, {} kept, {} total", pageNo, found.size(), kept, accepted.size());

            } catch (CdpCommandException e) {
                log.error("❌ Search aborted on page {}: {}", pageNo, e.getMessage());
                return SearchResult.failed(e.getMessage(), pagesVisited);

            } catch (RuntimeException e) {
                if (pageNo == 1) {
                    log.error("❌ Search setup failed: {}", e.getMessage());
                    return SearchResult.failed(e.getMessage(), pagesVisited);
                }
                log.warn("⚠️ Page {} failed, skipping: {}", pageNo, e.getMessage());
            }

            if (accepted.size() >= targetCount) {
                log.info("✅ Found {} candidates, stopping search", targetCount);
                break;
            }
            if (pageNo < pageLimit) {
                pageApi.humanPause();
            }
        }

        try {
            store.store(List.copyOf(accepted));
        } catch (RuntimeException e) {
            log.error("❌ Failed to store {} candidates: {}", accepted.size(), e.getMessage());
            return SearchResult.failed("store failed: " + e.getMessage(), pagesVisited);
        }

        log.info("🎯 Search complete: {} candidates found", accepted.size());
        return SearchResult.success(accepted, pagesVisited);
    }

    private List<Candidate> visitPage(String query, String location, int pageNo) {
        String url = urlBuilder.build(query, location, pageNo);
        log.debug("🌐 Navigating to: {}", url);
        pageApi.navigate(url);

        boolean ready = domActions.waitForSelector(properties.getResultsSelector(),
                Duration.ofMillis(properties.getWaitTimeoutMs()));
        if (!ready) {
            log.debug("Timeout waiting for search results on page {}", pageNo);
        }

        if (properties.getScrollPixels() > 0) {
            pageApi.scrollBy(properties.getScrollPixels());
        }

        List<Candidate> found = extractor.extractCandidatesFromPage();
        if (found.isEmpty()) {
            extractor.describePage();
        }
        return found;
    }

    /**
     * Добавляет кандидатов в порядке появления. Без profileUrl дедуплицировать нечем, такие пропускаем.
     *
     * @return сколько добавлено с этой страницы
     */
    private int accept(List<Candidate> found, String queryLower, double minScore, int targetCount,
                       List<Candidate> accepted, Set<String> acceptedUrls) {
        int kept = 0;
        for (Candidate c : found) {
            if (accepted.size() >= targetCount) break;

            String url = c.profileUrl();
            if (url == null || url.isBlank() || acceptedUrls.contains(url)) continue;

            String headline = c.headline() == null ? "" : c.headline().toLowerCase(Locale.ROOT);
            double score = scorer.score(headline, queryLower);
            if (score >= minScore) {
                accepted.add(c);
                acceptedUrls.add(url);
                kept++;
                log.info("   ✅ {} (Score: {})", c.name(), String.format(Locale.ROOT, "%.1f", score));
            } else {
                log.debug("   ❌ {} (Score: {})", c.name(), String.format(Locale.ROOT, "%.1f", score));
            }
        }
        return kept;
    }
}
