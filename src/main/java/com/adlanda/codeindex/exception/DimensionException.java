package com.adlanda.codeindex.exception;

/**
 * Thrown by the vector store when a vector written or queried does not have
 * the configured dimension. This is a client-input error, not a system fault.
 */
public class DimensionException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionException(int expected, int actual) {
        super(String.format("vector must be length %d, got %d", expected, actual));
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
