package com.adlanda.codeindex.model;

/**
 * What happened to one file during an indexing run.
 *
 * @param path      File path
 * @param status    Terminal state of the file
 * @param reason    Skip reason, null unless SKIPPED
 * @param chunks    Chunks written, 0 unless WRITTEN
 * @param sizeHint  Size reported by the tree listing
 * @param error     Failure message, null unless FAILED
 */
public record FileOutcome(
        String path,
        Status status,
        String reason,
        int chunks,
        long sizeHint,
        String error
) {
    public enum Status { WRITTEN, SKIPPED, FAILED }

    public static final String BINARY_OR_LARGE = "binary-or-large";
    public static final String NO_CHUNKS = "no-chunks";

    public static FileOutcome written(String path, int chunks, long sizeHint) {
        return new FileOutcome(path, Status.WRITTEN, null, chunks, sizeHint, null);
    }

    public static FileOutcome skipped(String path, String reason, long sizeHint) {
        return new FileOutcome(path, Status.SKIPPED, reason, 0, sizeHint, null);
    }

    public static FileOutcome failed(String path, String error, long sizeHint) {
        return new FileOutcome(path, Status.FAILED, null, 0, sizeHint, error);
    }
}
