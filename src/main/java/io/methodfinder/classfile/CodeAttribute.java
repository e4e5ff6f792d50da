package io.methodfinder.classfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decoded {@code Code} attribute.
 * <pre>
 * u2 max_stack;
 * u2 max_locals;
 * u4 code_length;
 * u1 code[code_length];
 * u2 exception_table_length;
 * { u2 start_pc; u2 end_pc; u2 handler_pc; u2 catch_type; } exception_table[exception_table_length];
 * u2 attributes_count;
 * attribute_info attributes[attributes_count];
 * </pre>
 *
 * @param maxStack       operand stack depth
 * @param maxLocals      local variable slots
 * @param code           raw bytecode, copied on construction; the accessor returns the held
 *                       array, which must not be modified
 * @param exceptionTable handler ranges in file order
 * @param attributes     nested attributes (LineNumberTable, LocalVariableTable, StackMapTable, ...)
 */
public record CodeAttribute(
    int maxStack,
    int maxLocals,
    byte[] code,
    List<ExceptionHandler> exceptionTable,
    List<Attribute> attributes
) implements Attribute {

    /**
     * One exception table row. {@code catchType} is a Class pool index, or 0 for a catch-all.
     */
    public record ExceptionHandler(int startPc, int endPc, int handlerPc, int catchType) {
    }

    public CodeAttribute {
        code = code.clone();
        exceptionTable = List.copyOf(exceptionTable);
        attributes = List.copyOf(attributes);
    }

    @Override
    public String name() {
        return CODE;
    }

    static CodeAttribute read(ByteReader in, ConstantPool pool) throws ClassFileFormatException {
        int maxStack = in.readU2();
        int maxLocals = in.readU2();
        int codeLength = in.readU4();
        if (codeLength < 0) {
            throw new ClassFileFormatException(ClassFileFormatException.Reason.MALFORMED_ATTRIBUTE,
                    "Negative code_length " + Integer.toUnsignedString(codeLength));
        }
        byte[] code = in.readBytes(codeLength);

        int handlerCount = in.readU2();
        List<ExceptionHandler> handlers = new ArrayList<>(handlerCount);
        for (int i = 0; i < handlerCount; i++) {
            handlers.add(new ExceptionHandler(in.readU2(), in.readU2(), in.readU2(), in.readU2()));
        }

        List<Attribute> attributes = AttributeReader.readAll(in, pool);
        return new CodeAttribute(maxStack, maxLocals, code, handlers, attributes);
    }

    /**
     * Source line for a bytecode offset, looked up in every LineNumberTable this attribute carries.
     * javac emits one table, but the format allows several; they are searched as one.
     */
    public OptionalInt lineAt(int offset) {
        List<LineNumberTable.Entry> merged = new ArrayList<>();
        for (Attribute attribute : attributes) {
            if (attribute instanceof LineNumberTable table) {
                merged.addAll(table.entries());
            }
        }
        return merged.isEmpty() ? OptionalInt.empty() : new LineNumberTable(merged).lineAt(offset);
    }

    /**
     * A nested LineNumberTable that could not be decoded. Offsets it would have covered have no line.
     */
    public Optional<Attribute.Malformed> malformedLineNumbers() {
        return attributes.stream()
            .filter(Attribute.Malformed.class::isInstance)
            .map(Attribute.Malformed.class::cast)
            .filter(a -> LINE_NUMBER_TABLE.equals(a.name()))
            .findFirst();
    }

    public boolean hasLineNumbers() {
        return attributes.stream().anyMatch(a -> a instanceof LineNumberTable);
    }
}
