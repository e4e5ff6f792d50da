package io.methodfinder.classfile;

/**
 * One decoded constant pool entry.
 * <p>
 * Index fields are raw u2 pool indices. They are not checked when the pool is read; a dangling
 * index only surfaces when something tries to resolve through it.
 */
public sealed interface ConstantPoolEntry {

    ConstantTag tag();

    record Utf8(String value) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.UTF8;
        }
    }

    record IntegerConstant(int value) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.INTEGER;
        }
    }

    record FloatConstant(float value) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.FLOAT;
        }
    }

    record LongConstant(long value) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.LONG;
        }
    }

    record DoubleConstant(double value) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.DOUBLE;
        }
    }

    record ClassEntry(int nameIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.CLASS;
        }
    }

    record StringConstant(int utf8Index) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.STRING;
        }
    }

    record Fieldref(int classIndex, int nameAndTypeIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.FIELDREF;
        }
    }

    record Methodref(int classIndex, int nameAndTypeIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.METHODREF;
        }
    }

    record InterfaceMethodref(int classIndex, int nameAndTypeIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.INTERFACE_METHODREF;
        }
    }

    record NameAndType(int nameIndex, int descriptorIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.NAME_AND_TYPE;
        }
    }

    record MethodHandle(int referenceKind, int referenceIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.METHOD_HANDLE;
        }
    }

    record MethodType(int descriptorIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.METHOD_TYPE;
        }
    }

    record Dynamic(int bootstrapMethodAttrIndex, int nameAndTypeIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.DYNAMIC;
        }
    }

    record InvokeDynamic(int bootstrapMethodAttrIndex, int nameAndTypeIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.INVOKE_DYNAMIC;
        }
    }

    record ModuleEntry(int nameIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.MODULE;
        }
    }

    record PackageEntry(int nameIndex) implements ConstantPoolEntry {
        @Override
        public ConstantTag tag() {
            return ConstantTag.PACKAGE;
        }
    }
}
