package redkv.commands.hash;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.SimpleString;

public class HSetCommand implements Command {
    private static final String[] NAME = {"hset"};

    public final String key;
    public final String field;
    public final Frame value;

    public HSetCommand(String key, String field, Frame value) {
        this.key = key;
        this.field = field;
        this.value = value;
    }

    public static HSetCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 3, true);
        return new HSetCommand(
                CommandArgs.stringArg(frames.get(1), "key"),
                CommandArgs.stringArg(frames.get(2), "field"),
                frames.get(3));
    }

    @Override
    public Frame execute(Backend backend) {
        backend.hset(key, field, value);
        return SimpleString.OK;
    }
}
