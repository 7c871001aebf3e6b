package com.adlanda.codeindex.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("index", "POST /api/v1/repos/{owner}/{name}/index?limit= - Index a repository");
        endpoints.put("indexStream", "GET /api/v1/repos/{owner}/{name}/index/stream?limit= - Index with live progress (SSE)");
        endpoints.put("purge", "DELETE /api/v1/repos/{owner}/{name}/index - Drop a repository's chunks");
        endpoints.put("files", "GET /api/v1/repos/{owner}/{name}/files - List files and index state");
        endpoints.put("filesSummary", "GET /api/v1/repos/{owner}/{name}/files/summary - Count indexed files");
        endpoints.put("search", "POST /api/v1/search - Nearest chunks to a query vector");
        endpoints.put("searchLatest", "GET /api/v1/search/latest?k= - Nearest chunks to the latest stored vector");
        endpoints.put("stats", "GET /api/v1/stats - Index statistics");
        endpoints.put("health", "GET /actuator/health - Health check");

        return ResponseEntity.ok(Map.of(
                "service", "Code Vector Index",
                "version", appVersion,
                "endpoints", endpoints
        ));
    }
}
