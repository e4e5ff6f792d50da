package io.methodfinder.classfile;

import java.util.List;

/**
 * A fully decoded class file.
 * <p>
 * Pool indices held here (this class, super class, interfaces, member names) are not checked at
 * parse time; use the resolving accessors, which throw {@link ResolutionException}.
 *
 * @param minorVersion   minor_version
 * @param majorVersion   major_version (52 = Java 8, 61 = Java 17)
 * @param constantPool   decoded pool
 * @param accessFlags    class ACC_* flags
 * @param thisClass      pool index of this class's Class entry
 * @param superClass     pool index of the super class's Class entry, 0 for java.lang.Object
 * @param interfaces     pool indices of directly implemented interfaces
 * @param fields         declared fields
 * @param methods        declared methods
 * @param attributes     class attributes
 */
public record ClassFile(
    int minorVersion,
    int majorVersion,
    ConstantPool constantPool,
    int accessFlags,
    int thisClass,
    int superClass,
    List<Integer> interfaces,
    List<FieldInfo> fields,
    List<MethodInfo> methods,
    List<Attribute> attributes
) {
    public static final int MAGIC = 0xCAFEBABE;

    public ClassFile {
        interfaces = List.copyOf(interfaces);
        fields = List.copyOf(fields);
        methods = List.copyOf(methods);
        attributes = List.copyOf(attributes);
    }

    /**
     * This class's internal name, e.g. {@code com/example/CallerClass}.
     */
    public String internalName() throws ResolutionException {
        return constantPool.className(thisClass);
    }

    /**
     * This class's binary name in dotted form, e.g. {@code com.example.CallerClass}.
     */
    public String className() throws ResolutionException {
        return internalName().replace('/', '.');
    }
}
