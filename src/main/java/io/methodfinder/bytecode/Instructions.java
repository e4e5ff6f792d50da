package io.methodfinder.bytecode;

import org.objectweb.asm.Opcodes;

/**
 * Instruction widths of the JVM instruction set (JVMS chapter 6).
 * <p>
 * Most opcodes have a fixed width. {@code tableswitch} and {@code lookupswitch} pad to a 4-byte
 * boundary measured from the start of the code array and then carry a table whose size is in
 * the instruction itself. {@code wide} widens the local variable index of the following load,
 * store, {@code ret} or {@code iinc}.
 */
public final class Instructions {

    /** Not in {@link Opcodes}: ASM folds these into their short forms. */
    public static final int LDC_W = 0x13;
    public static final int LDC2_W = 0x14;
    public static final int WIDE = 0xC4;
    public static final int GOTO_W = 0xC8;
    public static final int JSR_W = 0xC9;

    /** Fixed total width per opcode, 0 for variable-width or undefined opcodes. */
    private static final int[] WIDTHS = new int[256];

    static {
        fill(0x00, 0x0F, 1);               // nop, aconst_null, iconst_*, lconst_*, fconst_*, dconst_*
        WIDTHS[Opcodes.BIPUSH] = 2;
        WIDTHS[Opcodes.SIPUSH] = 3;
        WIDTHS[Opcodes.LDC] = 2;
        WIDTHS[LDC_W] = 3;
        WIDTHS[LDC2_W] = 3;
        fill(Opcodes.ILOAD, Opcodes.ALOAD, 2);
        fill(0x1A, 0x35, 1);               // *load_<n>, *aload
        fill(Opcodes.ISTORE, Opcodes.ASTORE, 2);
        fill(0x3B, 0x83, 1);               // *store_<n>, *astore, stack ops, arithmetic
        WIDTHS[Opcodes.IINC] = 3;
        fill(0x85, 0x98, 1);               // conversions, comparisons
        fill(Opcodes.IFEQ, Opcodes.JSR, 3);
        WIDTHS[Opcodes.RET] = 2;
        fill(Opcodes.IRETURN, Opcodes.RETURN, 1);
        fill(Opcodes.GETSTATIC, Opcodes.INVOKESTATIC, 3);
        WIDTHS[Opcodes.INVOKEINTERFACE] = 5;
        WIDTHS[Opcodes.INVOKEDYNAMIC] = 5;
        WIDTHS[Opcodes.NEW] = 3;
        WIDTHS[Opcodes.NEWARRAY] = 2;
        WIDTHS[Opcodes.ANEWARRAY] = 3;
        WIDTHS[Opcodes.ARRAYLENGTH] = 1;
        WIDTHS[Opcodes.ATHROW] = 1;
        WIDTHS[Opcodes.CHECKCAST] = 3;
        WIDTHS[Opcodes.INSTANCEOF] = 3;
        WIDTHS[Opcodes.MONITORENTER] = 1;
        WIDTHS[Opcodes.MONITOREXIT] = 1;
        WIDTHS[Opcodes.MULTIANEWARRAY] = 4;
        WIDTHS[Opcodes.IFNULL] = 3;
        WIDTHS[Opcodes.IFNONNULL] = 3;
        WIDTHS[GOTO_W] = 5;
        WIDTHS[JSR_W] = 5;
    }

    private Instructions() {
    }

    private static void fill(int from, int to, int width) {
        for (int op = from; op <= to; op++) {
            WIDTHS[op] = width;
        }
    }

    /**
     * Total width in bytes (opcode plus operands) of the instruction starting at {@code offset}.
     * The whole instruction is guaranteed to lie within {@code code}.
     */
    public static int width(byte[] code, int offset) throws MalformedBytecodeException {
        int opcode = code[offset] & 0xFF;
        int width = switch (opcode) {
            case Opcodes.TABLESWITCH -> tableSwitchWidth(code, offset);
            case Opcodes.LOOKUPSWITCH -> lookupSwitchWidth(code, offset);
            case WIDE -> wideWidth(code, offset);
            default -> WIDTHS[opcode];
        };
        if (width == 0) {
            throw new MalformedBytecodeException(offset, "Unknown opcode 0x" + Integer.toHexString(opcode));
        }
        if (width > code.length - offset) {
            throw new MalformedBytecodeException(offset, "Instruction 0x" + Integer.toHexString(opcode)
                    + " of width " + width + " runs past code_length " + code.length);
        }
        return width;
    }

    /**
     * Unsigned 16-bit operand at {@code offset}.
     */
    public static int u2(byte[] code, int offset) {
        return ((code[offset] & 0xFF) << 8) | (code[offset + 1] & 0xFF);
    }

    private static int padding(int offset) {
        return (4 - ((offset + 1) & 3)) & 3;
    }

    // tableswitch: pad, default, low, high, (high - low + 1) jump offsets
    private static int tableSwitchWidth(byte[] code, int offset) throws MalformedBytecodeException {
        int base = offset + 1 + padding(offset);
        requireWithin(code, offset, base + 12);
        int low = s4(code, base + 4);
        int high = s4(code, base + 8);
        if (high < low) {
            throw new MalformedBytecodeException(offset, "tableswitch high " + high + " < low " + low);
        }
        long width = (base - offset) + 12L + ((long) high - low + 1) * 4;
        return checkedWidth(code, offset, width);
    }

    // lookupswitch: pad, default, npairs, npairs * (match, offset)
    private static int lookupSwitchWidth(byte[] code, int offset) throws MalformedBytecodeException {
        int base = offset + 1 + padding(offset);
        requireWithin(code, offset, base + 8);
        int pairs = s4(code, base + 4);
        if (pairs < 0) {
            throw new MalformedBytecodeException(offset, "lookupswitch npairs " + pairs + " < 0");
        }
        long width = (base - offset) + 8L + (long) pairs * 8;
        return checkedWidth(code, offset, width);
    }

    private static int wideWidth(byte[] code, int offset) throws MalformedBytecodeException {
        requireWithin(code, offset, offset + 2);
        int modified = code[offset + 1] & 0xFF;
        if (modified == Opcodes.IINC) {
            return 6;
        }
        if ((modified >= Opcodes.ILOAD && modified <= Opcodes.ALOAD)
                || (modified >= Opcodes.ISTORE && modified <= Opcodes.ASTORE)
                || modified == Opcodes.RET) {
            return 4;
        }
        throw new MalformedBytecodeException(offset, "wide cannot modify opcode 0x" + Integer.toHexString(modified));
    }

    private static int checkedWidth(byte[] code, int offset, long width) throws MalformedBytecodeException {
        if (width > code.length - offset) {
            throw new MalformedBytecodeException(offset, "Switch table of " + width
                    + " bytes runs past code_length " + code.length);
        }
        return (int) width;
    }

    private static void requireWithin(byte[] code, int offset, int end) throws MalformedBytecodeException {
        if (end > code.length) {
            throw new MalformedBytecodeException(offset, "Instruction 0x" + Integer.toHexString(code[offset] & 0xFF)
                    + " runs past code_length " + code.length);
        }
    }

    private static int s4(byte[] code, int offset) {
        return ((code[offset] & 0xFF) << 24)
                | ((code[offset + 1] & 0xFF) << 16)
                | ((code[offset + 2] & 0xFF) << 8)
                | (code[offset + 3] & 0xFF);
    }
}
