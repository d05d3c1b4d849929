package redkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import redkv.db.Backend;
import redkv.network.ClientHandler;
import redkv.protocol.netty.NettyRespDecoder;
import redkv.protocol.netty.NettyRespEncoder;
import redkv.utils.Log;

/**
 * Server entry point: loads the config, creates the one shared {@link Backend}
 * and serves RESP over TCP until shut down.
 */
public class Redkv {

    public static final String VERSION = "0.1.0";
    private static final String DEFAULT_CONFIG = "redkv.yaml";

    // --- METRICS ---
    public static final AtomicLong totalCommands = new AtomicLong(0);
    public static final AtomicInteger activeConnections = new AtomicInteger(0);

    private static volatile boolean isRunning = true;

    public static void printBanner(Config config) {
        Log.info("\n" +
                " :: Redkv ::        (v" + VERSION + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " \n" +
                " :: Codec ::        " + config.codec + " \n");
    }

    /** Installs the RESP codec and the command handler on a connection's pipeline. */
    public static void initPipeline(ChannelPipeline pipeline, Config config, Backend backend) {
        pipeline.addLast(new NettyRespDecoder(config.newFrameDecoder(), config.maxFrameBytes));
        pipeline.addLast(new NettyRespEncoder());
        pipeline.addLast(new ClientHandler(backend));
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        Log.setLevel(config.logLevel);

        final Backend backend = new Backend();

        startMonitor(config, backend);
        printBanner(config);

        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     initPipeline(ch.pipeline(), config, backend);
                 }
             });

            ChannelFuture f = b.bind(config.host, config.port).sync();
            Log.info("Ready on " + config.host + ":" + config.port);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                Log.info("Shutting down...");
                isRunning = false;
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }));

            f.channel().closeFuture().sync();
        } finally {
            isRunning = false;
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    private static void startMonitor(Config config, Backend backend) {
        final int interval = config.statsIntervalSeconds;
        if (interval <= 0) return;

        Thread monitor = new Thread(() -> {
            long lastCount = 0;
            while (isRunning) {
                try {
                    Thread.sleep(interval * 1000L);
                    long currentCount = totalCommands.get();
                    long ops = (currentCount - lastCount) / interval;
                    lastCount = currentCount;

                    if (ops > 0 || activeConnections.get() > 0) {
                        Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s",
                            activeConnections.get(), backend.size(), ops));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }, "Monitor");
        monitor.setDaemon(true);
        monitor.start();
    }
}
