package io.methodfinder.bytecode;

import io.methodfinder.classfile.ConstantPool;
import io.methodfinder.classfile.ConstantPoolEntry;
import io.methodfinder.classfile.ResolutionException;
import io.methodfinder.model.MethodRef;

/**
 * Resolves the pool operand of an invoke instruction to the method it names.
 * <pre>
 * Methodref | InterfaceMethodref
 *   class_index         -> Class -> name_index -> Utf8 (internal class name)
 *   name_and_type_index -> NameAndType -> name_index       -> Utf8 (method name)
 *                                      -> descriptor_index -> Utf8 (descriptor)
 * </pre>
 * Both reference kinds are accepted for every invoke opcode; since Java 8, invokestatic and
 * invokespecial may legitimately point at either.
 */
public final class MethodRefResolver {

    private MethodRefResolver() {
    }

    public static MethodRef resolve(ConstantPool pool, int index) throws ResolutionException {
        ConstantPoolEntry entry = pool.get(index);
        int classIndex;
        int nameAndTypeIndex;
        if (entry instanceof ConstantPoolEntry.Methodref ref) {
            classIndex = ref.classIndex();
            nameAndTypeIndex = ref.nameAndTypeIndex();
        } else if (entry instanceof ConstantPoolEntry.InterfaceMethodref ref) {
            classIndex = ref.classIndex();
            nameAndTypeIndex = ref.nameAndTypeIndex();
        } else {
            throw new ResolutionException(ResolutionException.Reason.WRONG_ENTRY_KIND, index,
                    "Constant pool index " + index + " is " + entry.tag() + ", expected a method reference");
        }

        String className = pool.className(classIndex);
        ConstantPoolEntry.NameAndType nameAndType = pool.get(nameAndTypeIndex, ConstantPoolEntry.NameAndType.class);
        String methodName = pool.utf8(nameAndType.nameIndex());
        String descriptor = pool.utf8(nameAndType.descriptorIndex());
        return MethodRef.fromInternalName(className, methodName, descriptor);
    }
}
