package com.adlanda.codeindex.model;

import java.util.List;

/**
 * Result of a batch indexing run: the summary plus one outcome per file considered.
 */
public record IndexingReport(
        RepoInfo repo,
        String branch,
        String head,
        RunSummary counts,
        boolean cancelled,
        List<FileOutcome> results
) {}
