package com.respkv.network.protocol;

/**
 * Wire types of a RESP frame, keyed by their prefix byte.
 */
public enum FrameType {

    SIMPLE((byte) '+'),
    ERROR((byte) '-'),
    INTEGER((byte) ':'),
    BULK((byte) '$'),
    NULL((byte) '$'),
    ARRAY((byte) '*');

    private final byte prefix;

    FrameType(byte prefix) {
        this.prefix = prefix;
    }

    /**
     * Get the prefix byte written before the frame body.
     * NULL shares the bulk prefix and is told apart by its -1 length.
     */
    public byte getPrefix() {
        return prefix;
    }
}
