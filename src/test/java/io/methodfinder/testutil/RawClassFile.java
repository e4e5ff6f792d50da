package io.methodfinder.testutil;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Assembles class files byte by byte, for inputs ASM will not produce: raw bytecode, bad pool
 * indices, truncated or malformed attributes.
 */
public final class RawClassFile {

    private final ByteArrayOutputStream poolBytes = new ByteArrayOutputStream();
    private final DataOutputStream pool = new DataOutputStream(poolBytes);
    private int poolCount = 1;

    private final ByteArrayOutputStream methodBytes = new ByteArrayOutputStream();
    private final DataOutputStream methods = new DataOutputStream(methodBytes);
    private int methodCount;

    private int thisClass;
    private int superClass;

    public RawClassFile(String internalName) {
        this.thisClass = classRef(internalName);
        this.superClass = classRef("java/lang/Object");
    }

    /**
     * Overrides the this_class index, e.g. with one that does not resolve.
     */
    public RawClassFile thisClassIndex(int index) {
        this.thisClass = index;
        return this;
    }

    public int utf8(String value) {
        return entry(1, out -> out.writeUTF(value));
    }

    public int integer(int value) {
        return entry(3, out -> out.writeInt(value));
    }

    public int longConstant(long value) {
        int index = entry(5, out -> out.writeLong(value));
        poolCount++;
        return index;
    }

    public int doubleConstant(double value) {
        int index = entry(6, out -> out.writeDouble(value));
        poolCount++;
        return index;
    }

    public int classRef(String internalName) {
        int name = utf8(internalName);
        return entry(7, out -> out.writeShort(name));
    }

    public int nameAndType(String name, String descriptor) {
        int nameIndex = utf8(name);
        int descriptorIndex = utf8(descriptor);
        return entry(12, out -> {
            out.writeShort(nameIndex);
            out.writeShort(descriptorIndex);
        });
    }

    public int methodref(String owner, String name, String descriptor) {
        return ref(10, classRef(owner), nameAndType(name, descriptor));
    }

    public int interfaceMethodref(String owner, String name, String descriptor) {
        return ref(11, classRef(owner), nameAndType(name, descriptor));
    }

    /**
     * A Methodref with arbitrary, possibly dangling, indices.
     */
    public int ref(int tag, int classIndex, int nameAndTypeIndex) {
        return entry(tag, out -> {
            out.writeShort(classIndex);
            out.writeShort(nameAndTypeIndex);
        });
    }

    /**
     * Adds a method with a Code attribute holding {@code code} and, if given, a LineNumberTable
     * of {start_pc, line} pairs.
     */
    public RawClassFile method(String name, byte[] code, int[]... lineNumbers) {
        byte[] codeAttribute = bytes(out -> {
            out.writeShort(4);
            out.writeShort(4);
            out.writeInt(code.length);
            out.write(code);
            out.writeShort(0);
            if (lineNumbers.length == 0) {
                out.writeShort(0);
            } else {
                out.writeShort(1);
                out.writeShort(utf8("LineNumberTable"));
                out.writeInt(2 + lineNumbers.length * 4);
                out.writeShort(lineNumbers.length);
                for (int[] entry : lineNumbers) {
                    out.writeShort(entry[0]);
                    out.writeShort(entry[1]);
                }
            }
        });
        return methodWithAttribute(name, "Code", codeAttribute);
    }

    /**
     * Adds a method carrying one attribute with the given name and raw payload.
     */
    public RawClassFile methodWithAttribute(String name, String attributeName, byte[] payload) {
        int nameIndex = utf8(name);
        int descriptorIndex = utf8("()V");
        int attributeNameIndex = utf8(attributeName);
        write(methods, out -> {
            out.writeShort(0x0001);
            out.writeShort(nameIndex);
            out.writeShort(descriptorIndex);
            out.writeShort(1);
            out.writeShort(attributeNameIndex);
            out.writeInt(payload.length);
            out.write(payload);
        });
        methodCount++;
        return this;
    }

    public byte[] build() {
        return bytes(out -> {
            out.writeInt(0xCAFEBABE);
            out.writeShort(0);
            out.writeShort(52);
            out.writeShort(poolCount);
            out.write(poolBytes.toByteArray());
            out.writeShort(0x0021);
            out.writeShort(thisClass);
            out.writeShort(superClass);
            out.writeShort(0);
            out.writeShort(0);
            out.writeShort(methodCount);
            out.write(methodBytes.toByteArray());
            out.writeShort(0);
        });
    }

    private int entry(int tag, Body body) {
        int index = poolCount++;
        write(pool, out -> {
            out.writeByte(tag);
            body.write(out);
        });
        return index;
    }

    @FunctionalInterface
    public interface Body {
        void write(DataOutputStream out) throws IOException;
    }

    public static byte[] bytes(Body body) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        write(new DataOutputStream(buf), body);
        return buf.toByteArray();
    }

    private static void write(DataOutputStream out, Body body) {
        try {
            body.write(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
