package io.methodfinder.classfile;

/**
 * Thrown when a constant pool index chain cannot be followed to the entry it should reach.
 * <p>
 * Pool indices are validated lazily, so this is the point where a bad index in an otherwise
 * readable class file shows up. Callers decide whether that is fatal; the invocation scanner
 * simply skips the instruction.
 */
public class ResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** Index is 0, past the end of the pool, or the unusable slot after a Long/Double. */
        INDEX_OUT_OF_BOUNDS,
        /** Entry exists but has a different tag than the chain requires. */
        WRONG_ENTRY_KIND,
        /** A name or descriptor index does not point at a Utf8 entry. */
        UTF8_EXPECTED
    }

    private final Reason reason;
    private final int index;

    public ResolutionException(Reason reason, int index, String message) {
        super(message);
        this.reason = reason;
        this.index = index;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The pool index at which resolution failed.
     */
    public int index() {
        return index;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
