package redkv.commands;

import redkv.commands.connection.EchoCommand;
import redkv.commands.hash.HGetAllCommand;
import redkv.commands.hash.HGetCommand;
import redkv.commands.hash.HMGetCommand;
import redkv.commands.hash.HSetCommand;
import redkv.commands.set.AddMemberCommand;
import redkv.commands.set.SIsMemberCommand;
import redkv.commands.string.GetCommand;
import redkv.commands.string.SetCommand;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import redkv.protocol.BulkString;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;

/**
 * Turns a decoded request frame into a typed {@link Command}.
 * <p>
 * Names match case-insensitively. A name that is not registered yields an
 * {@link UnrecognizedCommand} rather than an error.
 */
public class CommandRegistry {

    public interface Parser {
        Command parse(RespArray frames) throws CommandException;
    }

    private static final Map<String, Parser> commands = new HashMap<>();

    static {
        // String
        register("GET", GetCommand::parse);
        register("SET", SetCommand::parse);

        // Hash
        register("HGET", HGetCommand::parse);
        register("HMGET", HMGetCommand::parse);
        register("HSET", HSetCommand::parse);
        register("HGETALL", HGetAllCommand::parse);

        // Set
        register("SISMEMBER", SIsMemberCommand::parse);
        register("ADDMEMBER", AddMemberCommand::parse);

        // Connection
        register("ECHO", EchoCommand::parse);
    }

    public static void register(String name, Parser parser) {
        commands.put(name.toLowerCase(Locale.ROOT), parser);
    }

    public static Parser get(String name) {
        return commands.get(name.toLowerCase(Locale.ROOT));
    }

    public static Command parse(Frame frame) throws CommandException {
        if (!(frame instanceof RespArray) || ((RespArray) frame).isNull()) {
            throw CommandException.invalidCommand("command must be an array");
        }
        RespArray frames = (RespArray) frame;
        if (frames.size() == 0 || !(frames.get(0) instanceof BulkString) || ((BulkString) frames.get(0)).isNull()) {
            throw CommandException.invalidCommand("command must have a bulk string as the first argument");
        }
        String name = new String(((BulkString) frames.get(0)).getBytes(), StandardCharsets.UTF_8);
        Parser parser = get(name);
        if (parser == null) {
            return new UnrecognizedCommand(name);
        }
        return parser.parse(frames);
    }
}
