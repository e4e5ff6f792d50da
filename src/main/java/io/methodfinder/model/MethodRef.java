package io.methodfinder.model;

/**
 * Symbolic method reference as it appears in a constant pool Methodref or InterfaceMethodref.
 *
 * @param classFqn    owning class in dotted form
 * @param methodName  method name
 * @param descriptor  JVM method descriptor
 */
public record MethodRef(
    String classFqn,
    String methodName,
    String descriptor
) {
    /**
     * Builds a reference from a slash-separated internal class name.
     */
    public static MethodRef fromInternalName(String internalClassName, String methodName, String descriptor) {
        return new MethodRef(internalClassName.replace('/', '.'), methodName, descriptor);
    }

    /**
     * Returns a human-readable signature.
     */
    public String signature() {
        return classFqn + "." + methodName + descriptor;
    }
}
