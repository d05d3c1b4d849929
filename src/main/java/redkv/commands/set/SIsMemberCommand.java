package redkv.commands.set;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.RespInteger;

public class SIsMemberCommand implements Command {
    private static final String[] NAME = {"sismember"};

    public final String key;
    public final String member;

    public SIsMemberCommand(String key, String member) {
        this.key = key;
        this.member = member;
    }

    public static SIsMemberCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 2, true);
        return new SIsMemberCommand(
                CommandArgs.stringArg(frames.get(1), "key"),
                CommandArgs.stringArg(frames.get(2), "member"));
    }

    @Override
    public Frame execute(Backend backend) {
        return backend.sismember(key, member) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
