package com.adlanda.codeindex.github;

import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.model.HeadRevision;
import com.adlanda.codeindex.model.RepoInfo;
import com.adlanda.codeindex.model.TreeEntry;

import java.util.List;

/**
 * Read access to a remote repository: metadata, the file tree at a revision
 * and file contents.
 *
 * Implementations throw {@link CollaboratorUnavailableException} when the
 * host cannot be reached or answers with an error.
 */
public interface TreeLister {

    /**
     * Fetches repository metadata, including its default branch.
     */
    RepoInfo repositoryInfo(String token, String owner, String name);

    /**
     * Resolves a branch to its head commit. Falls back to the first branch of
     * the repository when {@code branch} does not exist.
     */
    HeadRevision resolveHead(String token, String owner, String name, String branch);

    /**
     * Lists every blob in the tree at {@code head}, sorted by path.
     */
    List<TreeEntry> listBlobs(String token, String owner, String name, String head);

    /**
     * Fetches and decodes a blob.
     *
     * @param size Size hint from the tree listing, may be null
     * @return The decoded text, or null when the blob is binary, too large or undecodable
     */
    String fetchText(String token, String owner, String name, String contentRef, Long size);
}
