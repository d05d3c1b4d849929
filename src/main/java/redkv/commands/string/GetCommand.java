package redkv.commands.string;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.RespNull;

public class GetCommand implements Command {
    private static final String[] NAME = {"get"};

    public final String key;

    public GetCommand(String key) {
        this.key = key;
    }

    public static GetCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 1, true);
        return new GetCommand(CommandArgs.stringArg(frames.get(1), "key"));
    }

    @Override
    public Frame execute(Backend backend) {
        Frame value = backend.get(key);
        return value == null ? RespNull.INSTANCE : value;
    }
}
