package com.respkv.network;

import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.FrameCodec;
import com.respkv.network.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Reads and writes frames over a byte stream.
 *
 * Incoming bytes accumulate in one growable buffer that survives between calls.
 * Each {@link #readFrame()} first tries to decode a frame from what is already
 * buffered and only reads from the stream when that fails, so bytes of a
 * following frame received in the same read are kept for the next call.
 *
 * Not thread-safe: one connection is driven by one thread.
 */
public class Connection implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(Connection.class);
    private static final int INITIAL_BUFFER_SIZE = 4 * 1024;
    private static final int WRITE_BUFFER_SIZE = 8 * 1024;

    private final InputStream in;
    private final OutputStream out;
    private final Closeable resource;
    private final int maxFrameBytes;
    private final String remoteAddress;
    // Write mode between calls: [0, position) holds unconsumed bytes
    private ByteBuffer readBuffer;
    private boolean closed = false;

    /**
     * Create a connection over a connected socket.
     *
     * @param socket        the socket
     * @param maxFrameBytes largest frame the read buffer may grow to hold
     * @throws IOException if the socket streams cannot be obtained
     */
    public Connection(Socket socket, int maxFrameBytes) throws IOException {
        this(socket.getInputStream(), socket.getOutputStream(), socket,
            String.valueOf(socket.getRemoteSocketAddress()), maxFrameBytes);
    }

    /**
     * Create a connection over a pair of streams.
     *
     * @param in            source of request bytes
     * @param out           sink for reply bytes
     * @param maxFrameBytes largest frame the read buffer may grow to hold
     */
    public Connection(InputStream in, OutputStream out, int maxFrameBytes) {
        this(in, out, () -> {
            try {
                in.close();
            } finally {
                out.close();
            }
        }, "stream", maxFrameBytes);
    }

    private Connection(InputStream in, OutputStream out, Closeable resource,
                       String remoteAddress, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive, got: " + maxFrameBytes);
        }
        this.in = in;
        this.out = new BufferedOutputStream(out, WRITE_BUFFER_SIZE);
        this.resource = resource;
        this.remoteAddress = remoteAddress;
        this.maxFrameBytes = maxFrameBytes;
        this.readBuffer = ByteBuffer.allocate(Math.min(INITIAL_BUFFER_SIZE, maxFrameBytes));
    }

    /**
     * Read the next frame, blocking until one is complete.
     *
     * @return the frame, or empty if the peer closed cleanly between frames
     * @throws ConnectionResetException if the peer closed in the middle of a frame
     * @throws ProtocolException        if the buffered bytes are not a valid frame
     * @throws IOException              if reading fails
     */
    public Optional<Frame> readFrame() throws IOException {
        while (true) {
            Frame frame = parseBufferedFrame();
            if (frame != null) {
                return Optional.of(frame);
            }

            if (!readBuffer.hasRemaining()) {
                growReadBuffer();
            }

            int bytesRead = in.read(readBuffer.array(),
                readBuffer.arrayOffset() + readBuffer.position(), readBuffer.remaining());
            if (bytesRead == -1) {
                if (readBuffer.position() == 0) {
                    return Optional.empty();
                }
                throw new ConnectionResetException(readBuffer.position());
            }
            readBuffer.position(readBuffer.position() + bytesRead);
        }
    }

    /**
     * Try to take one frame off the front of the read buffer.
     *
     * @return the frame, or null if the buffer holds only part of one
     */
    private Frame parseBufferedFrame() {
        readBuffer.flip();
        if (!FrameCodec.check(readBuffer)) {
            // Back to write mode with every buffered byte kept
            readBuffer.position(readBuffer.limit());
            readBuffer.limit(readBuffer.capacity());
            return null;
        }

        int frameLength = readBuffer.position();
        readBuffer.position(0);
        Frame frame = FrameCodec.parse(readBuffer);
        if (readBuffer.position() != frameLength) {
            throw new ProtocolException("Frame length mismatch: checked " + frameLength +
                " bytes, parsed " + readBuffer.position());
        }
        readBuffer.compact();
        return frame;
    }

    /**
     * Double the read buffer, keeping the buffered bytes.
     * PRECONDITION: buffer is in write mode and full.
     */
    private void growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= maxFrameBytes) {
            throw new ProtocolException("Frame exceeds maximum size of " + maxFrameBytes + " bytes");
        }
        int newCapacity = (int) Math.min((long) currentCapacity * 2, maxFrameBytes);
        logger.debug("Growing read buffer from {} to {} bytes for {}",
            currentCapacity, newCapacity, remoteAddress);

        ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
        readBuffer.flip();
        newBuffer.put(readBuffer);
        readBuffer = newBuffer;
    }

    /**
     * Write a frame and flush it to the peer.
     *
     * @param frame the frame to send
     * @throws IOException if writing fails
     */
    public void writeFrame(Frame frame) throws IOException {
        FrameCodec.write(frame, out);
        out.flush();
    }

    /**
     * Get the number of bytes buffered but not yet returned as a frame.
     */
    public int bufferedBytes() {
        return readBuffer.position();
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    /**
     * Close the underlying stream or socket. Idempotent.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            resource.close();
        } catch (IOException e) {
            logger.debug("Error closing connection {}: {}", remoteAddress, e.getMessage());
        }
    }
}
