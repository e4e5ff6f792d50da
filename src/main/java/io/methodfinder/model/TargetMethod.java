package io.methodfinder.model;

/**
 * The method whose call sites are searched for. Matching is on class and name only, so every
 * overload of the name matches.
 *
 * @param className  fully qualified class name in dotted form, e.g. "java.lang.String"
 * @param methodName method name, e.g. "toString"
 */
public record TargetMethod(String className, String methodName) {

    /**
     * Returns true if a resolved reference names this class and method.
     */
    public boolean matches(MethodRef ref) {
        return className.equals(ref.classFqn()) && methodName.equals(ref.methodName());
    }

    /**
     * Returns "class#method", the form used as the report header.
     */
    public String key() {
        return className + "#" + methodName;
    }

    @Override
    public String toString() {
        return key();
    }
}
