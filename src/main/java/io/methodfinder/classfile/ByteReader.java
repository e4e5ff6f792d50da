package io.methodfinder.classfile;

import io.methodfinder.classfile.ClassFileFormatException.Reason;

import java.util.Arrays;

/**
 * Sequential big-endian cursor over an immutable byte array.
 * <p>
 * A reader can be restricted to a window of the array with {@link #slice(int)}, which is how
 * attribute payloads are decoded without being able to run into the bytes that follow them.
 * Every read either consumes exactly its width or throws {@link ClassFileFormatException}
 * with {@link Reason#UNEXPECTED_EOF}; the cursor never moves past {@link #limit()}.
 */
public final class ByteReader {

    private final byte[] buf;
    private final int start;
    private final int limit;
    private int pos;

    public ByteReader(byte[] buf) {
        this(buf, 0, buf.length);
    }

    private ByteReader(byte[] buf, int start, int limit) {
        this.buf = buf;
        this.start = start;
        this.limit = limit;
        this.pos = start;
    }

    public int readU1() throws ClassFileFormatException {
        require(1);
        return buf[pos++] & 0xFF;
    }

    public int readU2() throws ClassFileFormatException {
        require(2);
        int value = ((buf[pos] & 0xFF) << 8) | (buf[pos + 1] & 0xFF);
        pos += 2;
        return value;
    }

    /**
     * Reads a u4 as a signed int. Callers that treat the value as a length must reject negatives.
     */
    public int readU4() throws ClassFileFormatException {
        require(4);
        int value = ((buf[pos] & 0xFF) << 24)
                | ((buf[pos + 1] & 0xFF) << 16)
                | ((buf[pos + 2] & 0xFF) << 8)
                | (buf[pos + 3] & 0xFF);
        pos += 4;
        return value;
    }

    public long readU8() throws ClassFileFormatException {
        long high = readU4() & 0xFFFFFFFFL;
        long low = readU4() & 0xFFFFFFFFL;
        return (high << 32) | low;
    }

    public byte[] readBytes(int n) throws ClassFileFormatException {
        require(n);
        byte[] out = Arrays.copyOfRange(buf, pos, pos + n);
        pos += n;
        return out;
    }

    public void skip(int n) throws ClassFileFormatException {
        require(n);
        pos += n;
    }

    /**
     * Returns a reader over the next {@code n} bytes and advances this reader past them.
     */
    public ByteReader slice(int n) throws ClassFileFormatException {
        require(n);
        ByteReader sub = new ByteReader(buf, pos, pos + n);
        pos += n;
        return sub;
    }

    /**
     * Copy of this reader's whole window, independent of the cursor.
     */
    public byte[] contents() {
        return Arrays.copyOfRange(buf, start, limit);
    }

    /**
     * Offset relative to the start of this reader's window.
     */
    public int position() {
        return pos - start;
    }

    public int remaining() {
        return limit - pos;
    }

    public int limit() {
        return limit - start;
    }

    public boolean hasRemaining() {
        return pos < limit;
    }

    private void require(int n) throws ClassFileFormatException {
        if (n < 0 || n > limit - pos) {
            throw new ClassFileFormatException(Reason.UNEXPECTED_EOF,
                    "Unexpected end of data: need " + n + " byte(s) at offset " + position()
                            + ", " + remaining() + " remaining");
        }
    }
}
