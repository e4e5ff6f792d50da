package io.methodfinder.classfile;

import io.methodfinder.classfile.ResolutionException.Reason;

/**
 * Decoded constant pool with 1-based random access.
 * <p>
 * The table has {@code count} slots. Slot 0 is never used, and the slot following a Long or
 * Double entry is an unaddressable placeholder, exactly as in the class file format.
 */
public final class ConstantPool {

    private final ConstantPoolEntry[] entries;
    private int next = 1;

    ConstantPool(int count) {
        this.entries = new ConstantPoolEntry[Math.max(count, 1)];
    }

    /**
     * Stores an entry at the next free index and advances by the entry's slot size.
     *
     * @return the index the entry was stored at
     */
    int add(ConstantPoolEntry entry) {
        int index = next;
        entries[index] = entry;
        next += entry.tag().slotSize();
        return index;
    }

    /**
     * Number of slots including the unused slot 0 (the class file's {@code constant_pool_count}).
     */
    public int count() {
        return entries.length;
    }

    public boolean isAddressable(int index) {
        return index > 0 && index < entries.length && entries[index] != null;
    }

    public ConstantPoolEntry get(int index) throws ResolutionException {
        if (index <= 0 || index >= entries.length) {
            throw new ResolutionException(Reason.INDEX_OUT_OF_BOUNDS, index,
                    "Constant pool index " + index + " should be in range [1, " + (entries.length - 1) + "]");
        }
        ConstantPoolEntry entry = entries[index];
        if (entry == null) {
            throw new ResolutionException(Reason.INDEX_OUT_OF_BOUNDS, index,
                    "Constant pool index " + index + " is the second slot of a Long or Double entry");
        }
        return entry;
    }

    /**
     * Returns the entry at {@code index} if it is of the given kind.
     */
    public <T extends ConstantPoolEntry> T get(int index, Class<T> kind) throws ResolutionException {
        ConstantPoolEntry entry = get(index);
        if (!kind.isInstance(entry)) {
            throw new ResolutionException(Reason.WRONG_ENTRY_KIND, index,
                    "Constant pool index " + index + " is " + entry.tag() + ", expected " + kind.getSimpleName());
        }
        return kind.cast(entry);
    }

    public String utf8(int index) throws ResolutionException {
        ConstantPoolEntry entry = get(index);
        if (entry instanceof ConstantPoolEntry.Utf8 utf8) {
            return utf8.value();
        }
        throw new ResolutionException(Reason.UTF8_EXPECTED, index,
                "Constant pool index " + index + " is " + entry.tag() + ", expected Utf8");
    }

    /**
     * Follows a Class entry to its internal (slash-separated) name.
     */
    public String className(int index) throws ResolutionException {
        return utf8(get(index, ConstantPoolEntry.ClassEntry.class).nameIndex());
    }

    /**
     * Like {@link #utf8(int)}, but returns null instead of throwing.
     */
    public String utf8OrNull(int index) {
        if (!isAddressable(index)) {
            return null;
        }
        return entries[index] instanceof ConstantPoolEntry.Utf8 utf8 ? utf8.value() : null;
    }
}
