package com.adlanda.codeindex.model;

import java.util.List;

/**
 * Every file of a repository tree with its index state.
 */
public record RepositoryFiles(RepoInfo repo, List<FileStatus> files) {}
