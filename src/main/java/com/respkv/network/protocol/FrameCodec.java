package com.respkv.network.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP wire codec.
 *
 * Frame format:
 * <pre>
 *   +text\r\n                 simple string
 *   -text\r\n                 error
 *   :digits\r\n               unsigned integer
 *   $len\r\n bytes \r\n       bulk bytes ($-1\r\n is null)
 *   *count\r\n frame...       array
 * </pre>
 *
 * Decoding works on a ByteBuffer in read mode whose position is the first byte
 * of a frame. {@link #check} reports whether a whole frame is buffered without
 * copying payloads; {@link #parse} materializes it. On success both leave the
 * position just past the frame, so trailing bytes belong to the next frame.
 */
public final class FrameCodec {

    // Redis proto-max-bulk-len default
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 32;

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = {'$', '-', '1', CR, LF};

    // Sentinel for "line terminator not buffered yet"
    private static final int NO_LINE = -1;
    private static final long INCOMPLETE = Long.MIN_VALUE;

    private FrameCodec() {
        // Utility class
    }

    // ==================== Decoding ====================

    /**
     * Check whether a complete frame starts at the buffer's position.
     *
     * @param src buffer in read mode
     * @return true if a complete frame is present (position is then just past it),
     *         false if more bytes are needed (position is then undefined and the
     *         caller must reset it before retrying)
     * @throws ProtocolException if the bytes can never form a valid frame
     */
    public static boolean check(ByteBuffer src) {
        return check(src, 0);
    }

    private static boolean check(ByteBuffer src, int depth) {
        if (!src.hasRemaining()) {
            return false;
        }
        byte prefix = src.get();
        switch (prefix) {
            case '+':
            case '-': {
                int end = findLineEnd(src);
                if (end == NO_LINE) {
                    return false;
                }
                src.position(end + 2);
                return true;
            }
            case ':': {
                int end = findLineEnd(src);
                if (end == NO_LINE) {
                    return false;
                }
                parseUnsigned(src, src.position(), end);
                src.position(end + 2);
                return true;
            }
            case '$': {
                long length = readLength(src, true, MAX_BULK_LENGTH);
                if (length == INCOMPLETE) {
                    return false;
                }
                if (length == -1) {
                    return true;
                }
                if (src.remaining() < length + 2) {
                    return false;
                }
                int payloadEnd = src.position() + (int) length;
                expectCrlf(src, payloadEnd);
                src.position(payloadEnd + 2);
                return true;
            }
            case '*': {
                checkDepth(depth);
                long count = readLength(src, false, MAX_ARRAY_LENGTH);
                if (count == INCOMPLETE) {
                    return false;
                }
                for (long i = 0; i < count; i++) {
                    if (!check(src, depth + 1)) {
                        return false;
                    }
                }
                return true;
            }
            default:
                throw unknownType(prefix);
        }
    }

    /**
     * Parse the frame at the buffer's position.
     * Only call after {@link #check} has confirmed a complete frame; running out
     * of bytes here is reported as a protocol error.
     *
     * @param src buffer in read mode
     * @return the decoded frame, with the position just past it
     * @throws ProtocolException if the data is invalid or truncated
     */
    public static Frame parse(ByteBuffer src) {
        return parse(src, 0);
    }

    private static Frame parse(ByteBuffer src, int depth) {
        if (!src.hasRemaining()) {
            throw truncated();
        }
        byte prefix = src.get();
        switch (prefix) {
            case '+':
                return Frame.simple(readText(src));
            case '-':
                return Frame.error(readText(src));
            case ':': {
                int end = requireLineEnd(src);
                long value = parseUnsigned(src, src.position(), end);
                src.position(end + 2);
                return Frame.integer(value);
            }
            case '$': {
                long length = readLength(src, true, MAX_BULK_LENGTH);
                if (length == INCOMPLETE) {
                    throw truncated();
                }
                if (length == -1) {
                    return Frame.nullFrame();
                }
                if (src.remaining() < length + 2) {
                    throw truncated();
                }
                byte[] payload = new byte[(int) length];
                src.get(payload);
                expectCrlf(src, src.position());
                src.position(src.position() + 2);
                return Frame.wrapBulk(payload);
            }
            case '*': {
                checkDepth(depth);
                long count = readLength(src, false, MAX_ARRAY_LENGTH);
                if (count == INCOMPLETE) {
                    throw truncated();
                }
                List<Frame> elements = new ArrayList<>((int) count);
                for (long i = 0; i < count; i++) {
                    elements.add(parse(src, depth + 1));
                }
                return Frame.array(elements);
            }
            default:
                throw unknownType(prefix);
        }
    }

    // ==================== Encoding ====================

    /**
     * Serialize a frame to its wire bytes.
     *
     * @param frame the frame to encode
     * @return the encoded bytes
     */
    public static byte[] serialize(Frame frame) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(frame, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Write a frame's wire bytes to a stream. Does not flush.
     *
     * @param frame the frame to encode
     * @param out   destination stream
     * @throws IOException if the stream fails
     */
    public static void write(Frame frame, OutputStream out) throws IOException {
        switch (frame.getType()) {
            case SIMPLE:
            case ERROR:
                out.write(frame.getType().getPrefix());
                out.write(encodeLine(frame.getText()));
                out.write(CRLF);
                break;
            case INTEGER:
                out.write(':');
                out.write(ascii(Long.toUnsignedString(frame.getInteger())));
                out.write(CRLF);
                break;
            case BULK: {
                byte[] payload = frame.getBytesUnsafe();
                out.write('$');
                out.write(ascii(Integer.toString(payload.length)));
                out.write(CRLF);
                out.write(payload);
                out.write(CRLF);
                break;
            }
            case NULL:
                out.write(NULL_BULK);
                break;
            case ARRAY: {
                List<Frame> elements = frame.getElements();
                out.write('*');
                out.write(ascii(Integer.toString(elements.size())));
                out.write(CRLF);
                for (Frame element : elements) {
                    write(element, out);
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported frame type: " + frame.getType());
        }
    }

    // ==================== Helpers ====================

    /**
     * Find the index of the CR ending the line that starts at the position.
     *
     * @return index of CR, or NO_LINE if the terminator is not buffered yet
     */
    private static int findLineEnd(ByteBuffer src) {
        int limit = src.limit();
        for (int i = src.position(); i < limit; i++) {
            if (src.get(i) == CR) {
                if (i + 1 >= limit) {
                    return NO_LINE;
                }
                if (src.get(i + 1) != LF) {
                    throw new ProtocolException("Invalid line terminator: CR not followed by LF");
                }
                return i;
            }
        }
        return NO_LINE;
    }

    private static int requireLineEnd(ByteBuffer src) {
        int end = findLineEnd(src);
        if (end == NO_LINE) {
            throw truncated();
        }
        return end;
    }

    /**
     * Read a "len\r\n" header line.
     *
     * @return the length, -1 for null when allowed, or INCOMPLETE
     */
    private static long readLength(ByteBuffer src, boolean allowNull, int max) {
        int end = findLineEnd(src);
        if (end == NO_LINE) {
            return INCOMPLETE;
        }
        long length = parseSigned(src, src.position(), end);
        if (length < 0 && !(allowNull && length == -1)) {
            throw new ProtocolException("Invalid length: " + length);
        }
        if (length > max) {
            throw new ProtocolException("Length " + length + " exceeds maximum " + max);
        }
        src.position(end + 2);
        return length;
    }

    private static long parseSigned(ByteBuffer src, int start, int end) {
        if (start == end) {
            throw new ProtocolException("Empty number");
        }
        boolean negative = src.get(start) == '-';
        int i = negative ? start + 1 : start;
        if (i == end) {
            throw new ProtocolException("Invalid number: " + asciiString(src, start, end));
        }
        long value = 0;
        for (; i < end; i++) {
            byte b = src.get(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("Invalid number: " + asciiString(src, start, end));
            }
            if (value > (Long.MAX_VALUE - (b - '0')) / 10) {
                throw new ProtocolException("Number out of range: " + asciiString(src, start, end));
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    private static long parseUnsigned(ByteBuffer src, int start, int end) {
        String digits = asciiString(src, start, end);
        if (digits.isEmpty() || digits.charAt(0) == '+' || digits.charAt(0) == '-') {
            throw new ProtocolException("Invalid integer: " + digits);
        }
        try {
            return Long.parseUnsignedLong(digits);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid integer: " + digits, e);
        }
    }

    private static String readText(ByteBuffer src) {
        int end = requireLineEnd(src);
        ByteBuffer line = src.duplicate();
        line.limit(end);
        String text;
        try {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            CharBuffer chars = decoder.decode(line);
            text = chars.toString();
        } catch (CharacterCodingException e) {
            throw new ProtocolException("Invalid UTF-8 in line", e);
        }
        src.position(end + 2);
        return text;
    }

    private static void expectCrlf(ByteBuffer src, int index) {
        if (src.get(index) != CR || src.get(index + 1) != LF) {
            throw new ProtocolException("Bulk payload not terminated by CRLF");
        }
    }

    private static void checkDepth(int depth) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new ProtocolException("Array nesting exceeds " + MAX_NESTING_DEPTH);
        }
    }

    private static byte[] encodeLine(String text) {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new ProtocolException("Line frames cannot contain CR or LF");
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static String asciiString(ByteBuffer src, int start, int end) {
        byte[] raw = new byte[end - start];
        for (int i = start; i < end; i++) {
            raw[i - start] = src.get(i);
        }
        return new String(raw, StandardCharsets.US_ASCII);
    }

    private static ProtocolException truncated() {
        return new ProtocolException("Truncated frame");
    }

    private static ProtocolException unknownType(byte prefix) {
        return new ProtocolException(String.format("Unknown frame type byte: 0x%02X", prefix & 0xFF));
    }
}
