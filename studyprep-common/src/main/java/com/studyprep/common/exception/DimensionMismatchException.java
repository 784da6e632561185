package com.studyprep.common.exception;

public class DimensionMismatchException extends EmbeddingException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("DIMENSION_MISMATCH",
            String.format("Expected embedding with %d dimensions, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() { return expected; }
    public int getActual() { return actual; }
}
