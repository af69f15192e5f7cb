package com.coderag.errors;

/**
 * DimensionMismatchException - A vector does not have the dimension expected by the
 * gateway or by the vectors already stored in the index.
 */
public class DimensionMismatchException extends RagException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Vector dimension mismatch: expected " + expected + " but got " + actual);
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
