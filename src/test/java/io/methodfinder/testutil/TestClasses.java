package io.methodfinder.testutil;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

import static org.objectweb.asm.Opcodes.ACC_ABSTRACT;
import static org.objectweb.asm.Opcodes.ACC_PUBLIC;
import static org.objectweb.asm.Opcodes.ACC_SUPER;
import static org.objectweb.asm.Opcodes.V17;

/**
 * Generates class files with ASM for scanner tests. Method bodies are written with raw
 * MethodVisitor calls and must end with their own return instruction; frames are not computed,
 * which is fine because the classes are parsed, never loaded.
 */
public final class TestClasses {

    private TestClasses() {
    }

    public static Builder newClass(String internalName) {
        return new Builder(internalName);
    }

    /**
     * Marks the next instruction as starting source line {@code line}.
     */
    public static void line(MethodVisitor mv, int line) {
        Label label = new Label();
        mv.visitLabel(label);
        mv.visitLineNumber(line, label);
    }

    /**
     * Writes class bytes to {@code root/<internalName>.class}, creating package directories.
     */
    public static Path write(Path root, String internalName, byte[] bytes) throws IOException {
        Path file = root.resolve(internalName + ".class");
        Files.createDirectories(file.getParent());
        Files.write(file, bytes);
        return file;
    }

    public static final class Builder {
        private final ClassWriter cw = new ClassWriter(0);

        private Builder(String internalName) {
            cw.visit(V17, ACC_PUBLIC | ACC_SUPER, internalName, null, "java/lang/Object", null);
            String simpleName = internalName.substring(internalName.lastIndexOf('/') + 1);
            cw.visitSource(simpleName + ".java", null);
        }

        public Builder method(String name, Consumer<MethodVisitor> body) {
            return method(name, "()V", body);
        }

        public Builder method(String name, String descriptor, Consumer<MethodVisitor> body) {
            MethodVisitor mv = cw.visitMethod(ACC_PUBLIC, name, descriptor, null, null);
            mv.visitCode();
            body.accept(mv);
            mv.visitMaxs(10, 10);
            mv.visitEnd();
            return this;
        }

        public Builder abstractMethod(String name, String descriptor) {
            cw.visitMethod(ACC_PUBLIC | ACC_ABSTRACT, name, descriptor, null, null).visitEnd();
            return this;
        }

        public byte[] build() {
            cw.visitEnd();
            return cw.toByteArray();
        }
    }
}
