package com.adlanda.codeindex.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Default chunk sizing, prefixed with 'codeindex.chunking'.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "codeindex.chunking")
public class ChunkingProperties {

    /**
     * Soft ceiling for chunk length in characters. A single longer line is kept whole.
     */
    @Min(1)
    private int maxChars = 2000;

    /**
     * Trailing characters (whole lines only) carried into the next chunk.
     */
    @Min(1)
    private int overlapChars = 200;

    public int getMaxChars() {
        return maxChars;
    }

    public void setMaxChars(int maxChars) {
        this.maxChars = maxChars;
    }

    public int getOverlapChars() {
        return overlapChars;
    }

    public void setOverlapChars(int overlapChars) {
        this.overlapChars = overlapChars;
    }
}
