package com.adlanda.codeindex.github;

import com.adlanda.codeindex.config.GitHubProperties;
import com.adlanda.codeindex.config.IndexingProperties;
import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.model.HeadRevision;
import com.adlanda.codeindex.model.RepoInfo;
import com.adlanda.codeindex.model.TreeEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.Comparator;
import java.util.List;

/**
 * {@link TreeLister} backed by the GitHub REST API.
 *
 * Every call carries the caller's token and the configured connect/read
 * timeouts. HTTP and I/O failures surface as
 * {@link CollaboratorUnavailableException}.
 */
@Component
public class GitHubTreeLister implements TreeLister {

    private static final Logger log = LoggerFactory.getLogger(GitHubTreeLister.class);

    private static final MediaType GITHUB_JSON = MediaType.parseMediaType("application/vnd.github+json");

    private final RestTemplate restTemplate;
    private final GitHubProperties gitHubProperties;
    private final IndexingProperties indexingProperties;

    public GitHubTreeLister(RestTemplateBuilder restTemplateBuilder,
                            GitHubProperties gitHubProperties,
                            IndexingProperties indexingProperties) {
        this.gitHubProperties = gitHubProperties;
        this.indexingProperties = indexingProperties;
        this.restTemplate = restTemplateBuilder
                .rootUri(gitHubProperties.getApiUrl())
                .connectTimeout(gitHubProperties.getConnectTimeout())
                .readTimeout(gitHubProperties.getReadTimeout())
                .build();
    }

    @Override
    public RepoInfo repositoryInfo(String token, String owner, String name) {
        RepositoryResponse repo = get(token, RepositoryResponse.class, "/repos/{owner}/{name}", owner, name);
        String fullName = repo.fullName() != null ? repo.fullName() : owner + "/" + name;
        int slash = fullName.indexOf('/');
        return new RepoInfo(fullName.substring(0, slash), fullName.substring(slash + 1), repo.defaultBranch());
    }

    @Override
    public HeadRevision resolveHead(String token, String owner, String name, String branch) {
        if (branch != null) {
            try {
                BranchResponse response = get(token, BranchResponse.class,
                        "/repos/{owner}/{name}/branches/{branch}", owner, name, branch);
                return new HeadRevision(response.name(), response.commit().sha());
            } catch (CollaboratorUnavailableException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                log.warn("Branch {} not found in {}/{}, falling back to first branch", branch, owner, name);
            }
        }
        BranchResponse[] branches = get(token, BranchResponse[].class, "/repos/{owner}/{name}/branches", owner, name);
        if (branches == null || branches.length == 0) {
            throw new CollaboratorUnavailableException("No branches found in " + owner + "/" + name, 404, null);
        }
        return new HeadRevision(branches[0].name(), branches[0].commit().sha());
    }

    @Override
    public List<TreeEntry> listBlobs(String token, String owner, String name, String head) {
        TreeResponse tree = get(token, TreeResponse.class,
                "/repos/{owner}/{name}/git/trees/{sha}?recursive=1", owner, name, head);
        if (tree.tree() == null) {
            return List.of();
        }
        if (tree.truncated()) {
            log.warn("Tree listing for {}/{}@{} was truncated by GitHub", owner, name, head);
        }
        return tree.tree().stream()
                .filter(item -> "blob".equals(item.type()))
                .map(item -> new TreeEntry(item.path(), item.sha(), item.size()))
                .sorted(Comparator.comparing(TreeEntry::path))
                .toList();
    }

    @Override
    public String fetchText(String token, String owner, String name, String contentRef, Long size) {
        long maxBytes = indexingProperties.getMaxBlobBytes();
        if (size != null && size > maxBytes) {
            return null;
        }

        BlobResponse blob = get(token, BlobResponse.class,
                "/repos/{owner}/{name}/git/blobs/{sha}", owner, name, contentRef);
        if (!"base64".equals(blob.encoding())) {
            return null;
        }

        // GitHub wraps base64 content at 60 columns; the MIME decoder skips line breaks
        byte[] raw = Base64.getMimeDecoder().decode(blob.content() == null ? "" : blob.content());
        if (raw.length > maxBytes) {
            return null;
        }
        return BlobDecoder.decode(raw);
    }

    private <T> T get(String token, Class<T> type, String uriTemplate, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setAccept(List.of(GITHUB_JSON));
        headers.set("X-GitHub-Api-Version", gitHubProperties.getApiVersion());
        try {
            ResponseEntity<T> response = restTemplate.exchange(
                    uriTemplate, HttpMethod.GET, new HttpEntity<>(headers), type, uriVariables);
            T body = response.getBody();
            if (body == null) {
                throw new CollaboratorUnavailableException("Empty response from GitHub for " + uriTemplate, null);
            }
            return body;
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new CollaboratorUnavailableException(
                    "GitHub returned " + status + " for " + uriTemplate, status, e);
        } catch (RestClientException e) {
            throw new CollaboratorUnavailableException("GitHub request failed for " + uriTemplate + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RepositoryResponse(
            @JsonProperty("full_name") String fullName,
            @JsonProperty("default_branch") String defaultBranch) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BranchResponse(String name, CommitRef commit) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitRef(String sha) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TreeResponse(List<TreeItem> tree, boolean truncated) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TreeItem(String path, String type, String sha, Long size) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BlobResponse(String content, String encoding) {}
}
