package com.respkv.cmd;

import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;

import java.util.Optional;

/**
 * GET key: the stored value as bulk bytes, or null if missing or expired.
 */
public final class Get implements Command {

    static final String NAME = "get";

    private final String key;

    public Get(String key) {
        this.key = key;
    }

    static Get parse(CommandArguments args) {
        return new Get(args.nextString());
    }

    public String getKey() {
        return key;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Frame apply(KVStore store) {
        Optional<byte[]> value = store.get(key);
        return value.map(Frame::bulk).orElseGet(Frame::nullFrame);
    }

    @Override
    public String toString() {
        return "Get{key='" + key + "'}";
    }
}
