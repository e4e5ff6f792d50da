package io.methodfinder.bytecode;

import io.methodfinder.classfile.Attribute;
import io.methodfinder.classfile.ClassFile;
import io.methodfinder.classfile.CodeAttribute;
import io.methodfinder.classfile.ConstantPool;
import io.methodfinder.classfile.MethodInfo;
import io.methodfinder.classfile.ResolutionException;
import io.methodfinder.model.FoundCall;
import io.methodfinder.model.InvokeType;
import io.methodfinder.model.MethodRef;
import io.methodfinder.model.TargetMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Finds the invoke instructions in a class file that call the target method.
 * <p>
 * invokevirtual, invokespecial, invokestatic and invokeinterface are resolved through the
 * constant pool and compared with the target by class and method name. invokedynamic is
 * stepped over. Operands that do not resolve are skipped without a warning; bytecode that
 * cannot be walked ends the scan of that method only.
 */
public class InvocationScanner {

    private static final Logger log = LoggerFactory.getLogger(InvocationScanner.class);

    /**
     * Calls found in one class file plus the methods that could not be scanned.
     *
     * @param className      the scanned class in dotted form
     * @param calls          matches in method order, then offset order
     * @param methodWarnings one message per method that was skipped
     */
    public record ClassScan(String className, List<FoundCall> calls, List<String> methodWarnings) {
        public ClassScan {
            calls = List.copyOf(calls);
            methodWarnings = List.copyOf(methodWarnings);
        }
    }

    private final TargetMethod target;
    private final boolean includeTargetClass;

    public InvocationScanner(TargetMethod target) {
        this(target, false);
    }

    /**
     * @param target             class and method to look for
     * @param includeTargetClass whether calls made from inside the target class itself are reported
     */
    public InvocationScanner(TargetMethod target, boolean includeTargetClass) {
        this.target = target;
        this.includeTargetClass = includeTargetClass;
    }

    /**
     * Scans every method of a class file.
     *
     * @throws ResolutionException if the class's own name cannot be resolved
     */
    public ClassScan scan(ClassFile classFile) throws ResolutionException {
        String className = classFile.className();
        List<FoundCall> calls = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!includeTargetClass && className.equals(target.className())) {
            log.debug("Skipping target class itself: {}", className);
            return new ClassScan(className, calls, warnings);
        }
        log.debug("Visiting class: {}", className);

        ConstantPool pool = classFile.constantPool();
        for (MethodInfo method : classFile.methods()) {
            String methodName;
            try {
                methodName = method.name(pool);
            } catch (ResolutionException e) {
                warnings.add("Method name of " + className + " unresolvable: " + e.getMessage());
                continue;
            }

            Optional<Attribute.Malformed> malformed = method.malformedCode();
            if (malformed.isPresent()) {
                warnings.add("Malformed Code attribute in " + className + "#" + methodName
                        + ": " + malformed.get().problem());
                continue;
            }
            Optional<CodeAttribute> code = method.code();
            if (code.isEmpty()) {
                continue;
            }
            // calls are still scanned and reported without a line
            Optional<Attribute.Malformed> lineNumbers = code.get().malformedLineNumbers();
            if (lineNumbers.isPresent()) {
                warnings.add("Malformed LineNumberTable in " + className + "#" + methodName
                        + ": " + lineNumbers.get().problem());
            }

            try {
                calls.addAll(scanMethod(pool, className, methodName, code.get()));
            } catch (MalformedBytecodeException e) {
                warnings.add("Cannot scan " + className + "#" + methodName + ": " + e.getMessage());
            }
        }
        return new ClassScan(className, calls, warnings);
    }

    /**
     * Scans one method body.
     *
     * @param pool       constant pool of the enclosing class
     * @param className  enclosing class in dotted form, reported as the caller
     * @param methodName method name, reported as the caller
     * @param code       the method's Code attribute
     */
    public List<FoundCall> scanMethod(ConstantPool pool, String className, String methodName, CodeAttribute code)
            throws MalformedBytecodeException {
        log.debug("Visiting method: {}#{}", className, methodName);
        List<FoundCall> calls = new ArrayList<>();

        BytecodeWalker.walk(code.code(), (bytes, offset, opcode) -> {
            InvokeType invokeType = InvokeType.fromOpcode(opcode);
            if (invokeType == null) {
                return;
            }
            int index = Instructions.u2(bytes, offset + 1);
            MethodRef ref;
            try {
                ref = MethodRefResolver.resolve(pool, index);
            } catch (ResolutionException e) {
                log.debug("Skipping {} at {}#{}+{}: {}", invokeType.mnemonic(), className, methodName, offset,
                        e.getMessage());
                return;
            }
            if (!target.matches(ref)) {
                return;
            }
            OptionalInt line = code.lineAt(offset);
            FoundCall call = new FoundCall(className, methodName, line.isPresent() ? line.getAsInt() : null);
            calls.add(call);
            log.debug("Found method call: {} ({} {} at offset {})", call.formatted(), invokeType.mnemonic(),
                    ref.signature(), offset);
        });
        return calls;
    }
}
