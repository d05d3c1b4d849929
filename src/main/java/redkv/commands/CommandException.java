package redkv.commands;

/**
 * A request that could not be turned into a command. The connection stays
 * open; the client gets an error reply.
 */
public class CommandException extends Exception {

    public enum Kind {
        INVALID_COMMAND,
        INVALID_ARGUMENT,
        UTF8
    }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static CommandException invalidCommand(String message) {
        return new CommandException(Kind.INVALID_COMMAND, message);
    }

    public static CommandException invalidArgument(String message) {
        return new CommandException(Kind.INVALID_ARGUMENT, message);
    }

    public Kind getKind() {
        return kind;
    }

    /** Text for the {@code -ERR} reply. */
    public String toErrorMessage() {
        // client-supplied tokens may end up in the message; an error line cannot hold CR or LF
        String message = getMessage().replace('\r', ' ').replace('\n', ' ');
        switch (kind) {
            case INVALID_COMMAND: return "ERR invalid command: " + message;
            case INVALID_ARGUMENT: return "ERR invalid argument: " + message;
            case UTF8: return "ERR utf8 error: " + message;
            default: return "ERR " + message;
        }
    }
}
