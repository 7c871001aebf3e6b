package com.adlanda.codeindex.model;

/**
 * Repository metadata as reported by the remote host.
 *
 * @param owner          Repository owner (user or organization)
 * @param name           Repository name
 * @param defaultBranch  Branch that was indexed; may be null when unknown
 */
public record RepoInfo(
        String owner,
        String name,
        String defaultBranch
) {
    public RepositoryRef ref() {
        return new RepositoryRef(owner, name);
    }
}
