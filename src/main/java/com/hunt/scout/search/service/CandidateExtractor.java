package com.hunt.scout.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hunt.scout.browser.config.api.CdpPageApi;
import com.hunt.scout.browser.config.api.EvalResult;
import com.hunt.scout.search.dto.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Достаёт карточки со страницы выдачи одним JS-скриптом. Никогда не бросает: любой сбой = пустой список.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateExtractor {

    static final int MAX_CARDS_PER_PAGE = 30;

    // имя из строки "View X's profile", headline после строки "degree connection", url из первой ссылки на /in/
    static final String EXTRACTION_SCRIPT = """
            (() => {
              const containers = Array.from(document.querySelectorAll('.search-results-container li')).slice(0, %d);

              return containers.map(li => {
                const profileLink = li.querySelector('a[href*="/in/"]');
                const lines = li.textContent.split('\\n').map(l => l.trim()).filter(l => l && l !== 'Status is offline');

                let name = null;
                for (const line of lines) {
                  if (line.includes('s profile') && line.includes('View ') && !line.includes('•') && !line.includes('degree')) {
                    const viewIndex = line.indexOf('View ');
                    if (viewIndex > 0) {
                      const beforeView = line.substring(0, viewIndex).trim();
                      if (beforeView.length > 2 && beforeView.length < 50) {
                        name = beforeView;
                        break;
                      }
                    }
                  }
                }

                let headline = null;
                let foundConnectionLine = false;
                for (const line of lines) {
                  if (line.includes('degree connection')) {
                    foundConnectionLine = true;
                    continue;
                  }
                  if (foundConnectionLine && !line.includes('degree') && !line.includes('View ') &&
                      !line.includes('Status is') && !line.includes('Message') && line.length > 5) {
                    headline = line;
                    break;
                  }
                }

                if (!headline) {
                  for (const line of lines) {
                    if (!line.includes('View ') && !line.includes('degree') && !line.includes('Status') &&
                        !line.includes('Message') && !line.includes('mutual') && !line.includes('follower') &&
                        line.length > 10 && line.length < 200) {
                      headline = line;
                      break;
                    }
                  }
                }

                return {
                  name: name || null,
                  headline: headline || null,
                  url: (profileLink && profileLink.href) || null
                };
              }).filter(x => x.url || x.name);
            })()
            """.formatted(MAX_CARDS_PER_PAGE);

    static final String DIAGNOSTIC_SCRIPT = """
            (() => {
              const info = { url: window.location.href, containerCounts: {} };
              const selectors = [
                '.search-results-container li',
                'div.reusable-search__result-container',
                'li.reusable-search__result-container',
                '.entity-result',
                'ul.reusable-search__entity-result-list > li'
              ];
              selectors.forEach(sel => {
                const count = document.querySelectorAll(sel).length;
                if (count > 0) info.containerCounts[sel] = count;
              });
              const bodyText = (document.body && document.body.textContent) || '';
              info.hasNoResultsMessage = bodyText.includes('No results found') || bodyText.includes('0 results');
              info.profileLinkCount = document.querySelectorAll('a[href*="/in/"]').length;
              return info;
            })()
            """;

    private final CdpPageApi pageApi;

    public List<Candidate> extractCandidatesFromPage() {
        try {
            EvalResult result = pageApi.evaluate(EXTRACTION_SCRIPT);
            JsonNode value = result.valueOrNull();
            if (value == null || !value.isArray()) {
                log.debug("Extraction returned no list: {}", result);
                return List.of();
            }

            List<Candidate> candidates = new ArrayList<>();
            for (JsonNode entry : value) {
                if (!entry.isObject()) continue;

                String name = text(entry, "name");
                String url = text(entry, "url");
                if (url == null) url = text(entry, "profileUrl");
                if (name == null && url == null) continue;

                candidates.add(Candidate.builder()
                        .name(name)
                        .headline(text(entry, "headline"))
                        .profileUrl(url)
                        .build());
            }

            log.debug("Extracted {} candidates from page", candidates.size());
            return candidates;
        } catch (Exception e) {
            log.warn("Extraction error: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Логирует, что вообще есть на странице, когда карточек не нашлось.
     */
    public void describePage() {
        try {
            JsonNode info = pageApi.evaluateValue(DIAGNOSTIC_SCRIPT);
            if (info == null || !info.isObject()) return;

            log.debug("Page debug info: {}", info);
            if (info.path("hasNoResultsMessage").asBoolean(false)) {
                log.debug("Search returned 'No results found' message");
            }
            int links = info.path("profileLinkCount").asInt(0);
            if (links > 0) {
                log.debug("Found {} profile links but extraction failed", links);
            }
        } catch (Exception e) {
            log.debug("Page diagnostics failed: {}", e.getMessage());
        }
    }

    private String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
