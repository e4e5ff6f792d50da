package io.methodfinder.classfile;

import java.util.HashMap;
import java.util.Map;

/**
 * Constant pool entry kinds, keyed by their tag byte.
 * <p>
 * {@code slotSize} is the number of pool indices an entry occupies: 2 for Long and Double, 1 otherwise.
 */
public enum ConstantTag {
    UTF8(1, 1, "Utf8"),
    INTEGER(3, 1, "Integer"),
    FLOAT(4, 1, "Float"),
    LONG(5, 2, "Long"),
    DOUBLE(6, 2, "Double"),
    CLASS(7, 1, "Class"),
    STRING(8, 1, "String"),
    FIELDREF(9, 1, "Fieldref"),
    METHODREF(10, 1, "Methodref"),
    INTERFACE_METHODREF(11, 1, "InterfaceMethodref"),
    NAME_AND_TYPE(12, 1, "NameAndType"),
    METHOD_HANDLE(15, 1, "MethodHandle"),
    METHOD_TYPE(16, 1, "MethodType"),
    DYNAMIC(17, 1, "Dynamic"),
    INVOKE_DYNAMIC(18, 1, "InvokeDynamic"),
    MODULE(19, 1, "Module"),
    PACKAGE(20, 1, "Package");

    private static final Map<Integer, ConstantTag> BY_TAG = new HashMap<>();

    static {
        for (ConstantTag tag : values()) {
            BY_TAG.put(tag.tag, tag);
        }
    }

    private final int tag;
    private final int slotSize;
    private final String shortName;

    ConstantTag(int tag, int slotSize, String shortName) {
        this.tag = tag;
        this.slotSize = slotSize;
        this.shortName = shortName;
    }

    public int tag() {
        return tag;
    }

    public int slotSize() {
        return slotSize;
    }

    @Override
    public String toString() {
        return shortName;
    }

    /**
     * @return the kind for a tag byte, or null if the byte is not a known tag
     */
    public static ConstantTag byTag(int tag) {
        return BY_TAG.get(tag);
    }
}
