package io.methodfinder.bytecode;

/**
 * Walks a code array one instruction at a time, advancing by each instruction's exact width.
 * <p>
 * Offsets reported to the visitor are the instruction start offsets that LineNumberTable
 * entries refer to, so a single under- or over-counted instruction would shift every later one.
 */
public final class BytecodeWalker {

    @FunctionalInterface
    public interface InstructionVisitor {
        /**
         * @param code   the whole code array
         * @param offset start offset of the instruction
         * @param opcode unsigned opcode byte
         */
        void visitInstruction(byte[] code, int offset, int opcode);
    }

    private BytecodeWalker() {
    }

    /**
     * @return the offset after the last instruction, always {@code code.length} on success
     */
    public static int walk(byte[] code, InstructionVisitor visitor) throws MalformedBytecodeException {
        int offset = 0;
        while (offset < code.length) {
            int width = Instructions.width(code, offset);
            visitor.visitInstruction(code, offset, code[offset] & 0xFF);
            offset += width;
        }
        return offset;
    }
}
