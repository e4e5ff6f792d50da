package io.methodfinder.bytecode;

/**
 * Thrown when a method's bytecode cannot be walked instruction by instruction: an unknown or
 * reserved opcode, an instruction that runs past the end of the code array, or an invalid
 * switch or {@code wide} operand. Fatal for the method, not for the class file.
 */
public class MalformedBytecodeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public MalformedBytecodeException(int offset, String message) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Offset of the instruction that could not be decoded.
     */
    public int offset() {
        return offset;
    }
}
