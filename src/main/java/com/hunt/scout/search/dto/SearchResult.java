package com.hunt.scout.search.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {
    private boolean success;
    private int candidatesFound;
    @Builder.Default
    private List<Candidate> candidates = List.of();
    private String error;
    private String message;
    private int pagesVisited;

    public static SearchResult success(List<Candidate> candidates, int pagesVisited) {
        return SearchResult.builder()
                .success(true)
                .candidatesFound(candidates.size())
                .candidates(List.copyOf(candidates))
                .message("Found " + candidates.size() + " candidates")
                .pagesVisited(pagesVisited)
                .build();
    }

    public static SearchResult failed(String error, int pagesVisited) {
        return SearchResult.builder()
                .success(false)
                .candidatesFound(0)
                .error(error)
                .pagesVisited(pagesVisited)
                .build();
    }
}
