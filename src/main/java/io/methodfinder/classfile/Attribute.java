package io.methodfinder.classfile;

/**
 * A class, field, method or Code attribute.
 * <p>
 * Only {@code Code} and {@code LineNumberTable} are decoded; everything else is kept as an
 * opaque byte span.
 */
public sealed interface Attribute
        permits CodeAttribute, LineNumberTable, Attribute.Unknown, Attribute.Malformed {

    String CODE = "Code";
    String LINE_NUMBER_TABLE = "LineNumberTable";

    /**
     * The attribute name, or null if its name index does not resolve to a Utf8 entry.
     */
    String name();

    /**
     * An attribute that is not interpreted. {@code info} is copied on construction and must not be
     * modified through the accessor.
     */
    record Unknown(String name, byte[] info) implements Attribute {
        public Unknown {
            info = info.clone();
        }
    }

    /**
     * A {@code Code} or {@code LineNumberTable} attribute whose payload did not decode within its
     * declared length. {@code info} holds the raw payload, copied like {@link Unknown#info()}.
     */
    record Malformed(String name, byte[] info, String problem) implements Attribute {
        public Malformed {
            info = info.clone();
        }
    }
}
