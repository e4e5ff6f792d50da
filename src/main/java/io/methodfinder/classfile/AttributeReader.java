package io.methodfinder.classfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads attribute tables.
 * <pre>
 * u2 attributes_count;
 * { u2 attribute_name_index; u4 attribute_length; u1 info[attribute_length]; } attributes[attributes_count];
 * </pre>
 * Every payload is read through a slice of exactly {@code attribute_length} bytes. A Code or
 * LineNumberTable payload that fails to decode inside its slice becomes an
 * {@link Attribute.Malformed} rather than failing the whole class file, because the length
 * prefix still tells us where the next attribute starts.
 */
final class AttributeReader {

    private AttributeReader() {
    }

    static List<Attribute> readAll(ByteReader in, ConstantPool pool) throws ClassFileFormatException {
        int count = in.readU2();
        List<Attribute> attributes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            attributes.add(read(in, pool));
        }
        return attributes;
    }

    private static Attribute read(ByteReader in, ConstantPool pool) throws ClassFileFormatException {
        int nameIndex = in.readU2();
        int length = in.readU4();
        if (length < 0) {
            throw new ClassFileFormatException(ClassFileFormatException.Reason.MALFORMED_ATTRIBUTE,
                    "Attribute length " + Integer.toUnsignedString(length) + " exceeds class file size");
        }
        ByteReader payload = in.slice(length);
        String name = pool.utf8OrNull(nameIndex);

        if (Attribute.CODE.equals(name) || Attribute.LINE_NUMBER_TABLE.equals(name)) {
            try {
                Attribute decoded = Attribute.CODE.equals(name)
                        ? CodeAttribute.read(payload, pool)
                        : LineNumberTable.read(payload);
                if (payload.hasRemaining()) {
                    return malformed(name, payload, payload.remaining() + " trailing byte(s) after " + name + " payload");
                }
                return decoded;
            } catch (ClassFileFormatException e) {
                return malformed(name, payload, e.getMessage());
            }
        }
        return new Attribute.Unknown(name, payload.contents());
    }

    private static Attribute malformed(String name, ByteReader payload, String problem) {
        return new Attribute.Malformed(name, payload.contents(), problem);
    }
}
