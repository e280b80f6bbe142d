package com.respkv.cmd;

import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds]: store a value, replacing any
 * previous value and expiration.
 */
public final class Set implements Command {

    static final String NAME = "set";

    private static final Frame OK = Frame.simple("OK");

    private final String key;
    private final byte[] value;
    private final Duration expire; // null = no expiration

    public Set(String key, byte[] value, Duration expire) {
        this.key = key;
        this.value = value;
        this.expire = expire;
    }

    static Set parse(CommandArguments args) {
        String key = args.nextString();
        byte[] value = args.nextBytes();
        Duration expire = null;

        if (args.hasNext()) {
            String option = args.nextString().toUpperCase(Locale.ROOT);
            switch (option) {
                case "EX":
                    expire = Duration.ofSeconds(positive(args.nextLong()));
                    break;
                case "PX":
                    expire = Duration.ofMillis(positive(args.nextLong()));
                    break;
                default:
                    throw new CommandException("ERR syntax error");
            }
        }
        return new Set(key, value, expire);
    }

    private static long positive(long amount) {
        if (amount <= 0) {
            throw new CommandException("ERR invalid expire time in 'set' command");
        }
        return amount;
    }

    public String getKey() {
        return key;
    }

    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Get the requested time-to-live, or null for none.
     */
    public Duration getExpire() {
        return expire;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Frame apply(KVStore store) {
        store.set(key, value, expire);
        return OK;
    }

    @Override
    public String toString() {
        return "Set{key='" + key + "', valueLength=" + value.length +
               (expire != null ? ", expire=" + expire : "") + '}';
    }
}
