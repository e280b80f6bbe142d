package com.respkv.cmd;

import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.FrameType;
import com.respkv.network.protocol.ProtocolException;

import java.util.Locale;

/**
 * A decoded client request.
 */
public interface Command {

    /**
     * Get the lower-case command name, used for logging and metrics.
     */
    String getName();

    /**
     * Execute the command against the store.
     *
     * @param store the shared store
     * @return the reply frame to send to the client
     */
    Frame apply(KVStore store);

    /**
     * Decode a request frame into a command.
     *
     * @param frame the request, an array whose first element names the command
     * @return the command; unrecognized names decode to {@link Unknown}
     * @throws ProtocolException if the frame is not a non-empty array
     * @throws CommandException  if the arguments do not fit the command
     */
    static Command decode(Frame frame) {
        if (frame.getType() != FrameType.ARRAY) {
            throw new ProtocolException("Expected array frame, got " + frame.getType());
        }
        if (frame.getElements().isEmpty()) {
            throw new ProtocolException("Empty command array");
        }

        CommandArguments args = new CommandArguments(frame.getElements());
        String name = args.nextString().toLowerCase(Locale.ROOT);
        args.setCommandName(name);
        Command command;
        switch (name) {
            case Get.NAME:
                command = Get.parse(args);
                break;
            case Set.NAME:
                command = Set.parse(args);
                break;
            case Ping.NAME:
                command = Ping.parse(args);
                break;
            default:
                // Arguments of an unknown command are not inspected
                return new Unknown(name);
        }
        args.finish();
        return command;
    }
}
