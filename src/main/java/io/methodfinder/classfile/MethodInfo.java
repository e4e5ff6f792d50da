package io.methodfinder.classfile;

import org.objectweb.asm.Opcodes;

import java.util.List;
import java.util.Optional;

/**
 * A {@code method_info} structure.
 *
 * @param accessFlags     ACC_* flags
 * @param nameIndex       pool index of the method name (not validated until resolved)
 * @param descriptorIndex pool index of the method descriptor (not validated until resolved)
 * @param attributes      method attributes in file order
 */
public record MethodInfo(
    int accessFlags,
    int nameIndex,
    int descriptorIndex,
    List<Attribute> attributes
) {
    public MethodInfo {
        attributes = List.copyOf(attributes);
    }

    public String name(ConstantPool pool) throws ResolutionException {
        return pool.utf8(nameIndex);
    }

    /**
     * The method body. Abstract and native methods have none.
     */
    public Optional<CodeAttribute> code() {
        return attributes.stream()
            .filter(CodeAttribute.class::isInstance)
            .map(CodeAttribute.class::cast)
            .findFirst();
    }

    /**
     * A Code attribute that was present but could not be decoded.
     */
    public Optional<Attribute.Malformed> malformedCode() {
        return attributes.stream()
            .filter(Attribute.Malformed.class::isInstance)
            .map(Attribute.Malformed.class::cast)
            .filter(a -> Attribute.CODE.equals(a.name()))
            .findFirst();
    }

    public boolean isAbstract() {
        return (accessFlags & Opcodes.ACC_ABSTRACT) != 0;
    }

    public boolean isNative() {
        return (accessFlags & Opcodes.ACC_NATIVE) != 0;
    }
}
