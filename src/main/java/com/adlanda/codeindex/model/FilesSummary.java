package com.adlanda.codeindex.model;

/**
 * File counts for a repository: all blobs in the tree and how many are indexed.
 */
public record FilesSummary(RepoInfo repo, int total, int indexed) {}
