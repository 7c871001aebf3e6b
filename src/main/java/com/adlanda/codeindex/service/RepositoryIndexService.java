package com.adlanda.codeindex.service;

import com.adlanda.codeindex.credentials.CredentialStore;
import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.exception.NotConnectedException;
import com.adlanda.codeindex.github.TreeLister;
import com.adlanda.codeindex.model.FileStatus;
import com.adlanda.codeindex.model.FilesSummary;
import com.adlanda.codeindex.model.HeadRevision;
import com.adlanda.codeindex.model.PurgeResult;
import com.adlanda.codeindex.model.RepoInfo;
import com.adlanda.codeindex.model.RepositoryFiles;
import com.adlanda.codeindex.model.RepositoryRef;
import com.adlanda.codeindex.model.TreeEntry;
import com.adlanda.codeindex.repository.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Per-repository views of the index: which files are indexed, how many,
 * and dropping a repository's chunks.
 */
@Service
public class RepositoryIndexService {

    private static final Logger log = LoggerFactory.getLogger(RepositoryIndexService.class);

    private final CredentialStore credentialStore;
    private final TreeLister treeLister;
    private final VectorStore vectorStore;

    public RepositoryIndexService(CredentialStore credentialStore, TreeLister treeLister, VectorStore vectorStore) {
        this.credentialStore = credentialStore;
        this.treeLister = treeLister;
        this.vectorStore = vectorStore;
    }

    /**
     * Lists every file at the head of the default branch with its index state.
     *
     * @throws NotConnectedException if the user has no token
     * @throws CollaboratorUnavailableException if the tree cannot be fetched
     */
    public RepositoryFiles listFiles(String user, RepositoryRef ref) {
        String token = requireToken(user);
        RepoInfo repo = treeLister.repositoryInfo(token, ref.owner(), ref.name());
        List<TreeEntry> entries = headTree(token, repo);
        Set<String> indexed = vectorStore.indexedPaths(repo.owner(), repo.name());

        List<FileStatus> files = entries.stream()
                .map(entry -> new FileStatus(entry.path(), indexed.contains(entry.path())
                        ? FileStatus.Status.INDEXED
                        : FileStatus.Status.NOT_INDEXED))
                .toList();
        return new RepositoryFiles(repo, files);
    }

    /**
     * Counts files in the tree and how many of them are indexed. A repository
     * or tree that cannot be found counts as empty.
     */
    public FilesSummary summarize(String user, RepositoryRef ref) {
        String token = requireToken(user);
        try {
            RepoInfo repo = treeLister.repositoryInfo(token, ref.owner(), ref.name());
            List<TreeEntry> entries = headTree(token, repo);
            Set<String> indexed = vectorStore.indexedPaths(repo.owner(), repo.name());
            int indexedCount = (int) entries.stream().filter(entry -> indexed.contains(entry.path())).count();
            return new FilesSummary(repo, entries.size(), indexedCount);
        } catch (CollaboratorUnavailableException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("No tree for {}: {}", ref, e.getMessage());
            return new FilesSummary(new RepoInfo(ref.owner(), ref.name(), null), 0, 0);
        }
    }

    /**
     * Deletes all chunks of the repository so the next run indexes every file again.
     */
    public PurgeResult purge(RepositoryRef ref) {
        int deleted = vectorStore.purgeRepositoryIndex(ref.owner(), ref.name());
        return new PurgeResult(ref.owner(), ref.name(), deleted);
    }

    private List<TreeEntry> headTree(String token, RepoInfo repo) {
        HeadRevision head = treeLister.resolveHead(token, repo.owner(), repo.name(), repo.defaultBranch());
        return treeLister.listBlobs(token, repo.owner(), repo.name(), head.sha());
    }

    private String requireToken(String user) {
        return credentialStore.tokenFor(user)
                .orElseThrow(() -> new NotConnectedException(user));
    }
}
