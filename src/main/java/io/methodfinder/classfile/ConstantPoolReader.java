package io.methodfinder.classfile;

import io.methodfinder.classfile.ClassFileFormatException.Reason;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;

/**
 * Reads the constant pool section of a class file.
 * <pre>
 * u2 constant_pool_count;
 * cp_info constant_pool[constant_pool_count - 1];
 * </pre>
 */
public final class ConstantPoolReader {

    private ConstantPoolReader() {
    }

    /**
     * Reads {@code count - 1} slots worth of entries. The reader must be positioned on the first
     * entry's tag byte, just after {@code constant_pool_count}.
     */
    public static ConstantPool read(ByteReader in, int count) throws ClassFileFormatException {
        ConstantPool pool = new ConstantPool(count);
        int index = 1;
        while (index < count) {
            int tagByte = in.readU1();
            ConstantTag tag = ConstantTag.byTag(tagByte);
            if (tag == null) {
                throw new ClassFileFormatException(Reason.INVALID_CONSTANT_TAG,
                        "Unknown constant pool tag " + tagByte + " at index " + index);
            }
            pool.add(readEntry(tag, in));
            index += tag.slotSize();
        }
        return pool;
    }

    private static ConstantPoolEntry readEntry(ConstantTag tag, ByteReader in) throws ClassFileFormatException {
        return switch (tag) {
            case UTF8 -> new ConstantPoolEntry.Utf8(readModifiedUtf8(in));
            case INTEGER -> new ConstantPoolEntry.IntegerConstant(in.readU4());
            case FLOAT -> new ConstantPoolEntry.FloatConstant(Float.intBitsToFloat(in.readU4()));
            case LONG -> new ConstantPoolEntry.LongConstant(in.readU8());
            case DOUBLE -> new ConstantPoolEntry.DoubleConstant(Double.longBitsToDouble(in.readU8()));
            case CLASS -> new ConstantPoolEntry.ClassEntry(in.readU2());
            case STRING -> new ConstantPoolEntry.StringConstant(in.readU2());
            case FIELDREF -> new ConstantPoolEntry.Fieldref(in.readU2(), in.readU2());
            case METHODREF -> new ConstantPoolEntry.Methodref(in.readU2(), in.readU2());
            case INTERFACE_METHODREF -> new ConstantPoolEntry.InterfaceMethodref(in.readU2(), in.readU2());
            case NAME_AND_TYPE -> new ConstantPoolEntry.NameAndType(in.readU2(), in.readU2());
            case METHOD_HANDLE -> new ConstantPoolEntry.MethodHandle(in.readU1(), in.readU2());
            case METHOD_TYPE -> new ConstantPoolEntry.MethodType(in.readU2());
            case DYNAMIC -> new ConstantPoolEntry.Dynamic(in.readU2(), in.readU2());
            case INVOKE_DYNAMIC -> new ConstantPoolEntry.InvokeDynamic(in.readU2(), in.readU2());
            case MODULE -> new ConstantPoolEntry.ModuleEntry(in.readU2());
            case PACKAGE -> new ConstantPoolEntry.PackageEntry(in.readU2());
        };
    }

    /**
     * Utf8 entries hold modified UTF-8, the same encoding {@link DataInputStream#readUTF()} reads,
     * so the length-prefixed bytes are handed to it unchanged.
     */
    private static String readModifiedUtf8(ByteReader in) throws ClassFileFormatException {
        int length = in.readU2();
        byte[] bytes = in.readBytes(length);
        byte[] prefixed = new byte[length + 2];
        prefixed[0] = (byte) (length >>> 8);
        prefixed[1] = (byte) length;
        System.arraycopy(bytes, 0, prefixed, 2, length);
        try {
            return new DataInputStream(new ByteArrayInputStream(prefixed)).readUTF();
        } catch (IOException e) {
            throw new ClassFileFormatException(Reason.MALFORMED_UTF8,
                    "Malformed modified UTF-8 in constant pool: " + e.getMessage(), e);
        }
    }
}
