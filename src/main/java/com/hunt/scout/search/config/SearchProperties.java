package com.hunt.scout.search.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.search")
@Validated
@Getter
@Setter
public class SearchProperties {

    @NotBlank
    private String baseUrl = "https://www.linkedin.com/search/results/people/";

    /** F = 1st, S = 2nd, O = 3rd+; пусто = без фильтра */
    private String networkFilter = "F";

    @NotBlank
    private String resultsSelector = ".search-results-container li, .search-no-results";

    private long waitTimeoutMs = 10000;

    /** прокрутка для lazy-load карточек, 0 = не крутить */
    private int scrollPixels = 800;
}
