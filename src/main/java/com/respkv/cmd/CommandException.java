package com.respkv.cmd;

/**
 * Exception thrown when a well-formed frame holds an invalid command, such as a
 * wrong number of arguments. Reported to the client as an error reply; the
 * connection stays open.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Create the standard wrong-arity error for a command.
     */
    public static CommandException wrongArity(String commandName) {
        return new CommandException("ERR wrong number of arguments for '" + commandName + "' command");
    }
}
