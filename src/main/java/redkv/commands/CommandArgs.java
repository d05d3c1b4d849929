package redkv.commands;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import redkv.protocol.BulkString;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;

/**
 * Shared validation for the command parsers.
 */
public final class CommandArgs {

    private CommandArgs() { }

    /**
     * Checks the element count and that every name token matches, ignoring case.
     *
     * @param exact whether the command takes exactly {@code argCount} arguments
     *              rather than at least that many
     */
    public static void validate(RespArray frames, String[] names, int argCount, boolean exact) throws CommandException {
        int expected = names.length + argCount;
        int size = frames.size();
        if (size < expected || (exact && size != expected)) {
            throw CommandException.invalidCommand(String.join(" ", names) + " command must have "
                    + (exact ? "exactly " : "at least ") + argCount + " argument" + (argCount == 1 ? "" : "s"));
        }
        for (int i = 0; i < names.length; i++) {
            Frame frame = frames.get(i);
            if (!(frame instanceof BulkString) || ((BulkString) frame).isNull()) {
                throw CommandException.invalidCommand("command must have a bulk string as the first argument");
            }
            String token = new String(((BulkString) frame).getBytes(), StandardCharsets.UTF_8);
            if (!token.equalsIgnoreCase(names[i])) {
                throw CommandException.invalidCommand("expected " + names[i] + ", got " + token);
            }
        }
    }

    public static List<Frame> extractArgs(RespArray frames, int start) {
        return frames.getItems().subList(start, frames.size());
    }

    /**
     * Converts a bulk string argument to text; it must be valid UTF-8.
     */
    public static String stringArg(Frame frame, String argName) throws CommandException {
        if (!(frame instanceof BulkString) || ((BulkString) frame).isNull()) {
            throw CommandException.invalidArgument("invalid " + argName + " argument");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(((BulkString) frame).getBytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CommandException(CommandException.Kind.UTF8, argName + " is not valid UTF-8");
        }
    }
}
