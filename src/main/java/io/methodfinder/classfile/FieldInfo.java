package io.methodfinder.classfile;

import java.util.List;

/**
 * A {@code field_info} structure. Read so the methods that follow can be located; not interpreted.
 */
public record FieldInfo(
    int accessFlags,
    int nameIndex,
    int descriptorIndex,
    List<Attribute> attributes
) {
    public FieldInfo {
        attributes = List.copyOf(attributes);
    }
}
