package com.respkv.cmd;

import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;

/**
 * Any command name that is not recognized. Replies with an error and leaves
 * the connection open.
 */
public final class Unknown implements Command {

    private final String commandName;

    public Unknown(String commandName) {
        // Error replies are single lines
        this.commandName = commandName.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * Get the name the client sent, lower-cased.
     */
    public String getCommandName() {
        return commandName;
    }

    @Override
    public String getName() {
        return "unknown";
    }

    @Override
    public Frame apply(KVStore store) {
        return Frame.error("ERR unknown command '" + commandName + "'");
    }

    @Override
    public String toString() {
        return "Unknown{name='" + commandName + "'}";
    }
}
