package redkv.commands.hash;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.RespNull;

public class HGetCommand implements Command {
    private static final String[] NAME = {"hget"};

    public final String key;
    public final String field;

    public HGetCommand(String key, String field) {
        this.key = key;
        this.field = field;
    }

    public static HGetCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 2, true);
        return new HGetCommand(
                CommandArgs.stringArg(frames.get(1), "key"),
                CommandArgs.stringArg(frames.get(2), "field"));
    }

    @Override
    public Frame execute(Backend backend) {
        Frame value = backend.hget(key, field);
        return value == null ? RespNull.INSTANCE : value;
    }
}
