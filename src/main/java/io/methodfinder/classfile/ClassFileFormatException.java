package io.methodfinder.classfile;

import java.io.IOException;

/**
 * Thrown when a classfile's contents are not in the correct format.
 * <p>
 * Always fatal for the class file being parsed, never for a whole scan.
 */
public class ClassFileFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * What went wrong while decoding.
     */
    public enum Reason {
        /** A read needed more bytes than were left. */
        UNEXPECTED_EOF,
        /** The file does not start with 0xCAFEBABE. */
        INVALID_MAGIC,
        /** Unknown constant pool tag byte. */
        INVALID_CONSTANT_TAG,
        /** A Utf8 pool entry is not valid modified UTF-8. */
        MALFORMED_UTF8,
        /** An attribute payload does not match its declared layout. */
        MALFORMED_ATTRIBUTE
    }

    private final Reason reason;

    public ClassFileFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ClassFileFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Speed up exception (stack trace is not needed for this exception).
     */
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
