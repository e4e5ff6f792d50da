package io.methodfinder.model;

import org.objectweb.asm.Opcodes;

/**
 * Type of method invocation instruction.
 */
public enum InvokeType {
    /** Instance method call via vtable (invokevirtual) */
    VIRTUAL,
    /** Interface method call (invokeinterface) */
    INTERFACE,
    /** Static method call (invokestatic) */
    STATIC,
    /** Constructor, super call, or private method (invokespecial) */
    SPECIAL;

    /**
     * @return the invoke type for an opcode, or null if the opcode is not a resolvable invoke
     */
    public static InvokeType fromOpcode(int opcode) {
        return switch (opcode) {
            case Opcodes.INVOKEVIRTUAL -> VIRTUAL;
            case Opcodes.INVOKEINTERFACE -> INTERFACE;
            case Opcodes.INVOKESTATIC -> STATIC;
            case Opcodes.INVOKESPECIAL -> SPECIAL;
            default -> null;
        };
    }

    public String mnemonic() {
        return "invoke" + name().toLowerCase();
    }
}
