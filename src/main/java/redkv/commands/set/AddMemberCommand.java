package redkv.commands.set;

import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.RespInteger;

// ADDMEMBER key member: always replies 1, even if the member was already there
public class AddMemberCommand implements Command {
    private static final String[] NAME = {"addmember"};

    public final String key;
    public final String member;

    public AddMemberCommand(String key, String member) {
        this.key = key;
        this.member = member;
    }

    public static AddMemberCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 2, true);
        return new AddMemberCommand(
                CommandArgs.stringArg(frames.get(1), "key"),
                CommandArgs.stringArg(frames.get(2), "member"));
    }

    @Override
    public Frame execute(Backend backend) {
        backend.sadd(key, member);
        return RespInteger.ONE;
    }
}
