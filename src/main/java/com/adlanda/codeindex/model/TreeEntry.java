package com.adlanda.codeindex.model;

/**
 * A file (blob) in a remote repository tree.
 *
 * @param path        Path relative to the repository root, forward slashes
 * @param contentRef  Opaque reference used to fetch the content (the blob SHA on GitHub)
 * @param size        Size in bytes as reported by the tree listing, null when unknown
 */
public record TreeEntry(
        String path,
        String contentRef,
        Long size
) {
    public long sizeHint() {
        return size != null ? size : 0L;
    }
}
