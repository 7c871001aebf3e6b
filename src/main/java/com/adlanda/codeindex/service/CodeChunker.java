package com.adlanda.codeindex.service;

import com.adlanda.codeindex.config.ChunkingProperties;
import com.adlanda.codeindex.model.CodeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into overlapping chunks of whole lines.
 *
 * Lines are accumulated until the next one would push the chunk past
 * {@code maxChars}; the chunk is then cut and the next one starts with the
 * trailing lines of the previous chunk that fit in {@code overlapChars}.
 * A line is never split, so a single line longer than {@code maxChars}
 * becomes a chunk of its own.
 */
@Service
public class CodeChunker {

    private static final Logger log = LoggerFactory.getLogger(CodeChunker.class);

    private final ChunkingProperties properties;

    public CodeChunker(ChunkingProperties properties) {
        this.properties = properties;
    }

    /**
     * Chunks text with the configured default sizes.
     */
    public List<CodeChunk> chunk(String text) {
        return chunk(text, properties.getMaxChars(), properties.getOverlapChars());
    }

    /**
     * Chunks text into line-aligned pieces.
     *
     * @param text          Raw file content
     * @param maxChars      Soft ceiling for chunk length, in characters
     * @param overlapChars  Budget for trailing lines carried into the next chunk
     * @return Chunks in file order; empty for empty input
     */
    public List<CodeChunk> chunk(String text, int maxChars, int overlapChars) {
        if (maxChars < 1 || overlapChars < 1) {
            throw new IllegalArgumentException("maxChars and overlapChars must be positive");
        }

        List<String> lines = splitLines(text);
        if (lines.isEmpty()) {
            return List.of();
        }

        List<CodeChunk> chunks = new ArrayList<>();
        List<String> buffer = new ArrayList<>();
        int bufferChars = 0;
        int bufferStart = 0; // 0-based index of buffer.get(0)

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            if (bufferChars + line.length() > maxChars && !buffer.isEmpty()) {
                chunks.add(new CodeChunk(String.join("", buffer), bufferStart + 1, i));

                // Seed with trailing lines; the seed plus the current line must still fit in maxChars
                int budget = Math.min(overlapChars, maxChars - line.length());
                int tailChars = 0;
                int tailLines = 0;
                for (int j = buffer.size() - 1; j >= 0 && budget > 0; j--) {
                    int length = buffer.get(j).length();
                    if (tailChars + length > budget) {
                        break;
                    }
                    tailChars += length;
                    tailLines++;
                }

                buffer = new ArrayList<>(buffer.subList(buffer.size() - tailLines, buffer.size()));
                bufferChars = tailChars;
                bufferStart = i - tailLines;
            }

            buffer.add(line);
            bufferChars += line.length();
        }

        chunks.add(new CodeChunk(String.join("", buffer), bufferStart + 1, lines.size()));

        log.debug("Chunked input_len_chars={} lines={} into {} chunks (maxChars={}, overlapChars={})",
                text.length(), lines.size(), chunks.size(), maxChars, overlapChars);
        return chunks;
    }

    /**
     * Splits text into lines, each keeping its terminator ({@code \n}, {@code \r\n} or {@code \r}).
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < length && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
