package com.respkv.cmd;

import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;

/**
 * PING [message]: PONG, or the message echoed back as bulk bytes.
 */
public final class Ping implements Command {

    static final String NAME = "ping";

    private static final Frame PONG = Frame.simple("PONG");

    private final byte[] message; // null = plain PONG

    public Ping() {
        this(null);
    }

    public Ping(byte[] message) {
        this.message = message;
    }

    static Ping parse(CommandArguments args) {
        return args.hasNext() ? new Ping(args.nextBytes()) : new Ping();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Frame apply(KVStore store) {
        return message == null ? PONG : Frame.bulk(message);
    }

    @Override
    public String toString() {
        return message == null ? "Ping{}" : "Ping{messageLength=" + message.length + "}";
    }
}
