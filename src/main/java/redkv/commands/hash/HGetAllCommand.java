package redkv.commands.hash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import redkv.commands.Command;
import redkv.commands.CommandArgs;
import redkv.commands.CommandException;
import redkv.db.Backend;
import redkv.protocol.BulkString;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;

/**
 * Replies with a flat array of alternating field names and values. With
 * {@code sort} set the fields come in ascending order; otherwise in the hash's
 * iteration order. A missing key gives an empty array.
 */
public class HGetAllCommand implements Command {
    private static final String[] NAME = {"hgetall"};

    public final String key;
    public final boolean sort;

    public HGetAllCommand(String key, boolean sort) {
        this.key = key;
        this.sort = sort;
    }

    public static HGetAllCommand parse(RespArray frames) throws CommandException {
        CommandArgs.validate(frames, NAME, 1, true);
        return new HGetAllCommand(CommandArgs.stringArg(frames.get(1), "key"), false);
    }

    @Override
    public Frame execute(Backend backend) {
        Map<String, Frame> hash = backend.hgetAll(key);
        if (hash == null) {
            return RespArray.EMPTY;
        }
        List<Map.Entry<String, Frame>> data = new ArrayList<>(hash.entrySet());
        if (sort) {
            Collections.sort(data, Map.Entry.<String, Frame>comparingByKey());
        }
        List<Frame> flat = new ArrayList<>(data.size() * 2);
        for (Map.Entry<String, Frame> e : data) {
            flat.add(BulkString.of(e.getKey()));
            flat.add(e.getValue());
        }
        return new RespArray(flat);
    }
}
