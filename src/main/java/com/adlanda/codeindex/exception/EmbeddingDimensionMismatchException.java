package com.adlanda.codeindex.exception;

/**
 * Thrown when the provider returns a vector whose length differs from the
 * configured dimension.
 */
public class EmbeddingDimensionMismatchException extends EmbeddingProviderException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super(String.format("bad embed dim=%d expected=%d", actual, expected));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
