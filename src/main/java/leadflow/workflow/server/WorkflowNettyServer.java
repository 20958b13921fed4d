package leadflow.workflow.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import leadflow.workflow.config.Dependencies;
import leadflow.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP server for the workflow API. One instance per process.
 */
public final class WorkflowNettyServer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 8 * 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private WorkflowNettyServer() {
    }

    /** HTTP pipeline */
    static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Wire dependencies from the config and start serving.
     *
     * @return true if the server is running
     */
    public static synchronized boolean start(int port, WorkflowConfig config) {
        if (running) {
            return true;
        }
        Dependencies deps = Dependencies.create(config);
        if (!start(port, deps)) {
            deps.close();
            return false;
        }
        return true;
    }

    /**
     * Start serving with already wired dependencies. The server owns them from here on
     * and closes them in {@link #stop()}.
     */
    public static synchronized boolean start(int port, Dependencies deps) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            dependencies = deps;
            running = true;
            deps.startScheduler();
            log.info("Workflow server started on port {}", port);
            return true;
        } catch (Exception e) {
            log.error("Failed to start server on port {}", port, e);
            shutdownGroups();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            shutdownGroups();
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
            log.info("Workflow server stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * Dependencies of the running server, or null when stopped.
     */
    public static Dependencies dependencies() {
        return dependencies;
    }

    private static void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
