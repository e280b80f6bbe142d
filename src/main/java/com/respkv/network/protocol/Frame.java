package com.respkv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable RESP value: simple string, error, unsigned integer, bulk bytes,
 * null, or an array of frames.
 */
public final class Frame {

    private static final Frame NULL = new Frame(FrameType.NULL, null, 0, null, null);

    private final FrameType type;
    private final String text;        // SIMPLE, ERROR
    private final long integer;       // INTEGER, unsigned
    private final byte[] bytes;       // BULK
    private final List<Frame> elements; // ARRAY

    private Frame(FrameType type, String text, long integer, byte[] bytes, List<Frame> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.bytes = bytes;
        this.elements = elements;
    }

    /**
     * Create a simple string frame.
     */
    public static Frame simple(String text) {
        return new Frame(FrameType.SIMPLE, Objects.requireNonNull(text, "text"), 0, null, null);
    }

    /**
     * Create an error frame.
     */
    public static Frame error(String message) {
        return new Frame(FrameType.ERROR, Objects.requireNonNull(message, "message"), 0, null, null);
    }

    /**
     * Create an integer frame. The value is interpreted as unsigned 64-bit.
     */
    public static Frame integer(long value) {
        return new Frame(FrameType.INTEGER, null, value, null, null);
    }

    /**
     * Create a bulk frame holding a copy of the given bytes.
     */
    public static Frame bulk(byte[] value) {
        Objects.requireNonNull(value, "value");
        return new Frame(FrameType.BULK, null, 0, Arrays.copyOf(value, value.length), null);
    }

    /**
     * Create a bulk frame from UTF-8 text.
     */
    public static Frame bulk(String value) {
        return new Frame(FrameType.BULK, null, 0, value.getBytes(StandardCharsets.UTF_8), null);
    }

    /**
     * Get the null frame.
     */
    public static Frame nullFrame() {
        return NULL;
    }

    /**
     * Create an array frame.
     */
    public static Frame array(List<Frame> elements) {
        return new Frame(FrameType.ARRAY, null, 0, null,
            Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /**
     * Create an array frame.
     */
    public static Frame array(Frame... elements) {
        return array(Arrays.asList(elements));
    }

    // Takes ownership of the array, used by the codec after it has copied the payload.
    static Frame wrapBulk(byte[] value) {
        return new Frame(FrameType.BULK, null, 0, value, null);
    }

    public FrameType getType() {
        return type;
    }

    /**
     * Get the text of a simple or error frame.
     *
     * @throws IllegalStateException for any other type
     */
    public String getText() {
        if (type != FrameType.SIMPLE && type != FrameType.ERROR) {
            throw new IllegalStateException("Not a text frame: " + type);
        }
        return text;
    }

    /**
     * Get the value of an integer frame as an unsigned 64-bit number held in a long.
     */
    public long getInteger() {
        if (type != FrameType.INTEGER) {
            throw new IllegalStateException("Not an integer frame: " + type);
        }
        return integer;
    }

    /**
     * Get a copy of the bulk payload.
     */
    public byte[] getBytes() {
        byte[] raw = getBytesUnsafe();
        return Arrays.copyOf(raw, raw.length);
    }

    /**
     * Get the bulk payload without copying.
     * Do not modify the returned array.
     */
    public byte[] getBytesUnsafe() {
        if (type != FrameType.BULK) {
            throw new IllegalStateException("Not a bulk frame: " + type);
        }
        return bytes;
    }

    /**
     * Get the elements of an array frame.
     */
    public List<Frame> getElements() {
        if (type != FrameType.ARRAY) {
            throw new IllegalStateException("Not an array frame: " + type);
        }
        return elements;
    }

    public boolean isNull() {
        return type == FrameType.NULL;
    }

    public boolean isError() {
        return type == FrameType.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Frame frame = (Frame) o;
        return type == frame.type &&
               integer == frame.integer &&
               Objects.equals(text, frame.text) &&
               Arrays.equals(bytes, frame.bytes) &&
               Objects.equals(elements, frame.elements);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, text, integer, elements);
        result = 31 * result + Arrays.hashCode(bytes);
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE: return "Simple(" + text + ")";
            case ERROR: return "Error(" + text + ")";
            case INTEGER: return "Integer(" + Long.toUnsignedString(integer) + ")";
            case BULK: return "Bulk(length=" + bytes.length + ")";
            case NULL: return "Null";
            case ARRAY: return "Array" + elements;
            default: return "Frame(" + type + ")";
        }
    }
}
