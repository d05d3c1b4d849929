package redkv.commands.hash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;

public class HMGetCommand implements Command {
    private static final String[] NAME = {"hmget"};

    public final String key;
    public final List<String> fields;

    public HMGetCommand(String key, List<String> fields) {
        this.key = key;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    // HMGET key field [field ...]; the first bad field fails the whole request
    public static HMGetCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 2, false);
        List<Frame> args = CommandArgs.extractArgs(frames, 1);
        if (args.size() < 2) {
            throw CommandException.invalidArgument("HMGET command must have at least 2 arguments");
        }
        String key = CommandArgs.stringArg(args.get(0), "key");
        List<String> fields = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            fields.add(CommandArgs.stringArg(args.get(i), "field " + i));
        }
        return new HMGetCommand(key, fields);
    }

    @Override
    public Frame execute(Backend backend) {
        return backend.hmget(key, fields);
    }
}
