package br.edu.ifba.kgrag.storage;

/**
 * A vector collection, an embedding model and the configuration disagree on
 * the vector dimension. This is a configuration error and is never retried.
 */
public class VectorDimensionMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public VectorDimensionMismatchException(String subject, int expected, int actual) {
        super(String.format("Vector dimension mismatch for %s: expected %d but got %d", subject, expected, actual));
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
