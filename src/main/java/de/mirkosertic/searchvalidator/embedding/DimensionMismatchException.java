package de.mirkosertic.searchvalidator.embedding;

import de.mirkosertic.searchvalidator.ValidatorException;

/**
 * The embedding model and the collection disagree about the vector size.
 */
public class DimensionMismatchException extends ValidatorException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(final String source, final int expected, final int actual) {
        super(String.format("%s produced vectors of dimension %d, collection expects %d", source, actual, expected));
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
