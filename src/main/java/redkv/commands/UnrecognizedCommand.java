package redkv.commands;

import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.SimpleString;

/**
 * Any command name the registry does not know. Replies OK without touching the store.
 */
public class UnrecognizedCommand implements Command {
    public final String name;

    public UnrecognizedCommand(String name) {
        this.name = name;
    }

    @Override
    public Frame execute(Backend backend) {
        return SimpleString.OK;
    }
}
