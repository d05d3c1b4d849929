package redkv.commands;

import redkv.db.Backend;
import redkv.protocol.Frame;

public interface Command {
    // Runs the command against the store and returns the reply frame.
    // A command instance is built per request and executed once.
    Frame execute(Backend backend);
}
