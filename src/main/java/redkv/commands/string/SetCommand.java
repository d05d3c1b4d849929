package redkv.commands.string;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.SimpleString;

public class SetCommand implements Command {
    private static final String[] NAME = {"set"};

    public final String key;
    // stored as sent, whatever its frame type
    public final Frame value;

    public SetCommand(String key, Frame value) {
        this.key = key;
        this.value = value;
    }

    public static SetCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 2, true);
        return new SetCommand(CommandArgs.stringArg(frames.get(1), "key"), frames.get(2));
    }

    @Override
    public Frame execute(Backend backend) {
        backend.set(key, value);
        return SimpleString.OK;
    }
}
