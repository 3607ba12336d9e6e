package org.learningjava.photosearch.domain.error;

/**
 * Thrown when an embedding's length differs from the dimensionality already held by the store.
 */
public class DimensionMismatchException extends StoreException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
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
