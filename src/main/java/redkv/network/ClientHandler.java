package redkv.network;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import redkv.Redkv;
import redkv.commands.Command;
import redkv.commands.CommandException;
import redkv.commands.CommandRegistry;
import redkv.commands.UnrecognizedCommand;
import redkv.db.Backend;
import redkv.protocol.Frame;
import redkv.protocol.SimpleError;
import redkv.utils.Log;

/**
 * Per-connection handler: each decoded request frame becomes a command, runs
 * against the shared {@link Backend}, and its reply is written back. Replies are
 * flushed once per read so pipelined requests go out together.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final Backend backend;

    public ClientHandler(Backend backend) {
        this.backend = backend;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        Redkv.activeConnections.incrementAndGet();
        Log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Redkv.activeConnections.decrementAndGet();
        Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof Frame)) {
            super.channelRead(ctx, msg);
            return;
        }
        ctx.write(handle((Frame) msg));
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        ctx.flush();
        super.channelReadComplete(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.error("Closing connection " + ctx.channel().remoteAddress() + " after error: " + cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Parses and executes one request. Command errors become {@code -ERR} replies.
     */
    public Frame handle(Frame request) {
        Redkv.totalCommands.incrementAndGet();
        try {
            Command cmd = CommandRegistry.parse(request);
            if (cmd instanceof UnrecognizedCommand && Log.isDebugEnabled()) {
                Log.debug("Unrecognized command: " + ((UnrecognizedCommand) cmd).name);
            }
            return cmd.execute(backend);
        } catch (CommandException e) {
            Log.debug("Command error: " + e.getMessage());
            return new SimpleError(e.toErrorMessage());
        }
    }
}
