package com.hunt.scout.search.service;

import com.hunt.scout.search.config.SearchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
public class SearchUrlBuilder {

    private final SearchProperties properties;

    /**
     * keywords=query+location, затем network (должен идти до page), затем page для страниц после первой.
     */
    public String build(String query, String location, int pageNo) {
        String keywords = (location == null || location.isBlank())
                ? query.trim()
                : (query.trim() + " " + location.trim());

        StringBuilder url = new StringBuilder(properties.getBaseUrl())
                .append("?keywords=")
                .append(URLEncoder.encode(keywords, StandardCharsets.UTF_8));

        String network = properties.getNetworkFilter();
        if (network != null && !network.isBlank()) {
            url.append("&network=[%22").append(network.trim()).append("%22]");
        }

        if (pageNo > 1) {
            url.append("&page=").append(pageNo);
        }
        return url.toString();
    }
}
