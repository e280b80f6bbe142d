package com.respkv.cmd;

import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.FrameType;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cursor over the elements of a request array.
 * Commands take their arguments in order; anything left over is an arity error.
 */
public class CommandArguments {

    private final List<Frame> elements;
    private int index = 0;
    private String commandName = "";

    public CommandArguments(List<Frame> elements) {
        this.elements = elements;
    }

    /**
     * Name the command being parsed, for arity errors.
     */
    public void setCommandName(String commandName) {
        this.commandName = commandName;
    }

    public boolean hasNext() {
        return index < elements.size();
    }

    /**
     * Get the number of arguments not consumed yet.
     */
    public int remaining() {
        return elements.size() - index;
    }

    /**
     * Take the next argument as UTF-8 text.
     *
     * @throws CommandException if there is none or it is not a string
     */
    public String nextString() {
        Frame frame = next();
        switch (frame.getType()) {
            case SIMPLE:
                return frame.getText();
            case BULK:
                try {
                    return StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(frame.getBytesUnsafe()))
                        .toString();
                } catch (CharacterCodingException e) {
                    throw new CommandException("ERR invalid UTF-8 in argument", e);
                }
            default:
                throw new CommandException("ERR expected string argument, got " + frame.getType());
        }
    }

    /**
     * Take the next argument as raw bytes.
     *
     * @throws CommandException if there is none or it is not a string
     */
    public byte[] nextBytes() {
        Frame frame = next();
        switch (frame.getType()) {
            case BULK:
                return frame.getBytes();
            case SIMPLE:
                return frame.getText().getBytes(StandardCharsets.UTF_8);
            default:
                throw new CommandException("ERR expected string argument, got " + frame.getType());
        }
    }

    /**
     * Take the next argument as a signed decimal integer.
     *
     * @throws CommandException if there is none or it is not an integer
     */
    public long nextLong() {
        if (hasNext() && elements.get(index).getType() == FrameType.INTEGER) {
            return next().getInteger();
        }
        String text = nextString();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new CommandException("ERR value is not an integer or out of range", e);
        }
    }

    /**
     * Verify that every argument was consumed.
     *
     * @throws CommandException if arguments are left over
     */
    public void finish() {
        if (hasNext()) {
            throw CommandException.wrongArity(commandName);
        }
    }

    private Frame next() {
        if (!hasNext()) {
            throw CommandException.wrongArity(commandName);
        }
        return elements.get(index++);
    }
}
