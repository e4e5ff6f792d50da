package io.methodfinder.model;

import java.util.Comparator;
import java.util.Optional;

/**
 * One call site of the target method.
 *
 * @param className  calling class in dotted form
 * @param methodName calling method
 * @param lineNumber source line of the invoke instruction, null when the method has no line
 *                   number information covering it
 */
public record FoundCall(
    String className,
    String methodName,
    Integer lineNumber
) {
    /**
     * Orders by class, then method, then line (unknown lines first).
     */
    public static final Comparator<FoundCall> ORDER = Comparator
        .comparing(FoundCall::className)
        .thenComparing(FoundCall::methodName)
        .thenComparing(FoundCall::lineNumber, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Optional<Integer> line() {
        return Optional.ofNullable(lineNumber);
    }

    /**
     * Returns "class#method (Lnn)", omitting the line suffix when the line is unknown.
     */
    public String formatted() {
        String location = className + "#" + methodName;
        return lineNumber != null ? location + " (L" + lineNumber + ")" : location;
    }
}
