package com.respkv.network;

import java.io.IOException;

/**
 * Thrown when the peer closes the stream while a frame is only partially buffered.
 */
public class ConnectionResetException extends IOException {

    private final int bufferedBytes;

    public ConnectionResetException(int bufferedBytes) {
        super("Connection reset by peer with " + bufferedBytes + " bytes of an incomplete frame buffered");
        this.bufferedBytes = bufferedBytes;
    }

    /**
     * Get the number of bytes that were buffered when the peer went away.
     */
    public int getBufferedBytes() {
        return bufferedBytes;
    }
}
