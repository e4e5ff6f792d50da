package io.methodfinder.classfile;

import io.methodfinder.classfile.ClassFileFormatException.Reason;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the JVM class file format.
 * <pre>
 * ClassFile {
 *     u4 magic;
 *     u2 minor_version;
 *     u2 major_version;
 *     u2 constant_pool_count;
 *     cp_info constant_pool[constant_pool_count - 1];
 *     u2 access_flags;
 *     u2 this_class;
 *     u2 super_class;
 *     u2 interfaces_count;
 *     u2 interfaces[interfaces_count];
 *     u2 fields_count;
 *     field_info fields[fields_count];
 *     u2 methods_count;
 *     method_info methods[methods_count];
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 * </pre>
 * Only the magic number is validated eagerly. Structural truncation anywhere fails the parse.
 */
public final class ClassFileParser {

    private ClassFileParser() {
    }

    public static ClassFile parse(byte[] bytes) throws ClassFileFormatException {
        return parse(new ByteReader(bytes));
    }

    public static ClassFile parse(ByteReader in) throws ClassFileFormatException {
        if (in.remaining() < 4) {
            throw new ClassFileFormatException(Reason.INVALID_MAGIC,
                    "Not a class file: only " + in.remaining() + " byte(s)");
        }
        int magic = in.readU4();
        if (magic != ClassFile.MAGIC) {
            throw new ClassFileFormatException(Reason.INVALID_MAGIC,
                    "Not a class file: bad magic 0x" + Integer.toHexString(magic).toUpperCase());
        }
        int minor = in.readU2();
        int major = in.readU2();

        int poolCount = in.readU2();
        ConstantPool pool = ConstantPoolReader.read(in, poolCount);

        int accessFlags = in.readU2();
        int thisClass = in.readU2();
        int superClass = in.readU2();

        int interfaceCount = in.readU2();
        List<Integer> interfaces = new ArrayList<>(interfaceCount);
        for (int i = 0; i < interfaceCount; i++) {
            interfaces.add(in.readU2());
        }

        int fieldCount = in.readU2();
        List<FieldInfo> fields = new ArrayList<>(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            fields.add(new FieldInfo(in.readU2(), in.readU2(), in.readU2(), AttributeReader.readAll(in, pool)));
        }

        int methodCount = in.readU2();
        List<MethodInfo> methods = new ArrayList<>(methodCount);
        for (int i = 0; i < methodCount; i++) {
            methods.add(new MethodInfo(in.readU2(), in.readU2(), in.readU2(), AttributeReader.readAll(in, pool)));
        }

        List<Attribute> attributes = AttributeReader.readAll(in, pool);

        return new ClassFile(minor, major, pool, accessFlags, thisClass, superClass,
                interfaces, fields, methods, attributes);
    }
}
