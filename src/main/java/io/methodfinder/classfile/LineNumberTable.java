package io.methodfinder.classfile;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Decoded {@code LineNumberTable} attribute.
 * <pre>
 * u2 line_number_table_length;
 * { u2 start_pc; u2 line_number; } line_number_table[line_number_table_length];
 * </pre>
 * Entries are kept in file order, which compilers emit ascending by {@code start_pc}.
 */
public record LineNumberTable(List<Entry> entries) implements Attribute {

    public record Entry(int startPc, int lineNumber) {
    }

    public LineNumberTable {
        entries = List.copyOf(entries);
    }

    @Override
    public String name() {
        return LINE_NUMBER_TABLE;
    }

    static LineNumberTable read(ByteReader in) throws ClassFileFormatException {
        int length = in.readU2();
        List<Entry> entries = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            entries.add(new Entry(in.readU2(), in.readU2()));
        }
        return new LineNumberTable(entries);
    }

    /**
     * Source line of the instruction starting at {@code offset}: the line of the entry with the
     * greatest {@code start_pc <= offset}. When several entries share that {@code start_pc} the
     * last one in the table wins.
     *
     * @return the line, or empty if no entry starts at or before the offset
     */
    public OptionalInt lineAt(int offset) {
        Entry best = null;
        for (Entry entry : entries) {
            if (entry.startPc() <= offset && (best == null || entry.startPc() >= best.startPc())) {
                best = entry;
            }
        }
        return best == null ? OptionalInt.empty() : OptionalInt.of(best.lineNumber());
    }
}
