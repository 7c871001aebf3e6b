package com.adlanda.codeindex.controller;

import com.adlanda.codeindex.model.SearchRequest;
import com.adlanda.codeindex.model.SearchResponse;
import com.adlanda.codeindex.service.RetrievalService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for nearest-neighbor search over the index.
 */
@RestController
@RequestMapping("/api/v1")
public class SearchController {

    private final RetrievalService retrievalService;

    public SearchController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Finds the chunks closest to a query vector.
     *
     * @param request The query vector and number of results
     * @return SearchResponse with matched chunks and metadata
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        return ResponseEntity.ok(retrievalService.search(request.query(), request.k()));
    }

    /**
     * Searches with the most recently stored embedding as the query.
     */
    @GetMapping("/search/latest")
    public ResponseEntity<SearchResponse> searchFromLatest(
            @RequestParam(defaultValue = "5") @Min(1) @Max(100) int k) {
        return ResponseEntity.ok(retrievalService.searchFromLatest(k));
    }

    /**
     * Get index statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        long totalChunks = retrievalService.getIndexSize();
        return ResponseEntity.ok(Map.of(
                "total_chunks", totalChunks,
                "status", totalChunks > 0 ? "indexed" : "empty"
        ));
    }
}
