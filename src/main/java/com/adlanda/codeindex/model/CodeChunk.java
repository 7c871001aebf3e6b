package com.adlanda.codeindex.model;

/**
 * A contiguous run of whole lines cut from a source file.
 *
 * @param text       The chunk content, line terminators included
 * @param startLine  First line of the chunk (1-based, inclusive)
 * @param endLine    Last line of the chunk (1-based, inclusive)
 */
public record CodeChunk(
        String text,
        int startLine,
        int endLine
) {
    /**
     * Number of lines covered by this chunk.
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }
}
