package redkv.commands.connection;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.BulkString;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;

public class EchoCommand implements Command {
    private static final String[] NAME = {"echo"};

    public final String message;

    public EchoCommand(String message) {
        this.message = message;
    }

    public static EchoCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 1, true);
        return new EchoCommand(CommandArgs.stringArg(frames.get(1), "message"));
    }

    @Override
    public Frame execute(Backend backend) {
        return BulkString.of(message);
    }
}
