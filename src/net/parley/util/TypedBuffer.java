package net.parley.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A growable big-endian buffer of typed protocol fields.
 * Writes append at the end; reads consume from a separate cursor, so a
 * buffer filled by a sender can be read back by a test without copying.
 * Strings are encoded as a 32-bit unsigned byte length followed by UTF-8.
 */
public class TypedBuffer {

    public static final int INITIAL_SIZE = 64;
    public static final int MAX_STRING_LENGTH = 65536;

    private byte[] data;
    private int length;
    private int position;

    public TypedBuffer() {
        data = new byte[INITIAL_SIZE];
    }
    public TypedBuffer(ByteBuffer source) {
        length = source.remaining();
        data = new byte[Math.max(length, INITIAL_SIZE)];
        source.get(data, 0, length);
    }

    public int length() {
        return length;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return length - position;
    }

    public void rewind() {
        position = 0;
    }

    public TypedBuffer writeUInt16(int value) {
        if (value < 0 || value > 0xFFFF)
            throw new IllegalArgumentException("Value out of range for " +
                "u16: " + value);
        ensureCapacity(2);
        data[length++] = (byte) (value >> 8);
        data[length++] = (byte) value;
        return this;
    }

    public TypedBuffer writeUInt32(long value) {
        if (value < 0 || value > 0xFFFFFFFFL)
            throw new IllegalArgumentException("Value out of range for " +
                "u32: " + value);
        ensureCapacity(4);
        data[length++] = (byte) (value >> 24);
        data[length++] = (byte) (value >> 16);
        data[length++] = (byte) (value >>  8);
        data[length++] = (byte) value;
        return this;
    }

    public TypedBuffer writeString(String value) {
        byte[] enc = value.getBytes(StandardCharsets.UTF_8);
        writeUInt32(enc.length);
        writeBytes(enc);
        return this;
    }

    public TypedBuffer writeBytes(byte[] bytes) {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, data, length, bytes.length);
        length += bytes.length;
        return this;
    }

    public TypedBuffer write(TypedBuffer other) {
        ensureCapacity(other.length);
        System.arraycopy(other.data, 0, data, length, other.length);
        length += other.length;
        return this;
    }

    public int readUInt16() throws MalformedDataException {
        require(2, "u16");
        int ret = (data[position] & 0xFF) << 8 | data[position + 1] & 0xFF;
        position += 2;
        return ret;
    }

    public long readUInt32() throws MalformedDataException {
        require(4, "u32");
        long ret = (long) (data[position    ] & 0xFF) << 24 |
                   (long) (data[position + 1] & 0xFF) << 16 |
                   (long) (data[position + 2] & 0xFF) <<  8 |
                   (long) (data[position + 3] & 0xFF);
        position += 4;
        return ret;
    }

    public String readString() throws MalformedDataException {
        long len = readUInt32();
        if (len > MAX_STRING_LENGTH)
            throw new MalformedDataException("String too long (" + len +
                " bytes)");
        require((int) len, "string body");
        CharsetDecoder dec = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        String ret;
        try {
            ret = dec.decode(ByteBuffer.wrap(data, position, (int) len))
                .toString();
        } catch (CharacterCodingException exc) {
            throw new MalformedDataException("Invalid UTF-8 in string",
                                             exc);
        }
        position += (int) len;
        return ret;
    }

    /**
     * The readable region as a read-only buffer; the cursor is not moved.
     */
    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(data, position, length - position)
            .slice().asReadOnlyBuffer();
    }

    public byte[] toByteArray() {
        byte[] ret = new byte[length];
        System.arraycopy(data, 0, ret, 0, length);
        return ret;
    }

    private void require(int count, String what)
            throws MalformedDataException {
        if (count < 0 || length - position < count)
            throw new MalformedDataException("Truncated " + what + " at " +
                "offset " + position);
    }

    private void ensureCapacity(int extra) {
        if (length + extra <= data.length) return;
        int ncap = data.length * 2;
        while (ncap < length + extra) ncap *= 2;
        byte[] ndata = new byte[ncap];
        System.arraycopy(data, 0, ndata, 0, length);
        data = ndata;
    }

}
