package com.wheelseye.respserver.config;

import com.wheelseye.respserver.command.CommandRegistry;
import com.wheelseye.respserver.exception.RespServerException;
import com.wheelseye.respserver.handler.RespConnectionSession;
import com.wheelseye.respserver.helper.ConnectionTracker;
import com.wheelseye.respserver.protocol.resp.RespReplyEncoder;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty TCP server for the RESP protocol, bound to the Spring lifecycle.
 *
 * Starts once the application is ready and stops on context shutdown. Every accepted
 * socket gets the pipeline:
 * <pre>
 * [idleState] → replyEncoder → session
 * </pre>
 * where the session owns the connection's frame parser and the encoder turns reply
 * values into RESP bytes on the way out.
 */
@Configuration
public class RespTcpServer {

    private static final Logger logger = LoggerFactory.getLogger(RespTcpServer.class);

    // ==================== Dependencies ====================

    private final RespServerProperties.Tcp tcp;
    private final CommandRegistry commandRegistry;
    private final RespReplyEncoder replyEncoder;
    private final ObjectProvider<RespConnectionSession> sessionProvider;
    private final ConnectionTracker connectionTracker;

    // ==================== Server State ====================

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile boolean serverStarted = false;

    public RespTcpServer(RespServerProperties properties, CommandRegistry commandRegistry,
                         RespReplyEncoder replyEncoder, ObjectProvider<RespConnectionSession> sessionProvider,
                         ConnectionTracker connectionTracker) {
        this.tcp = properties.tcp();
        this.commandRegistry = commandRegistry;
        this.replyEncoder = replyEncoder;
        this.sessionProvider = sessionProvider;
        this.connectionTracker = connectionTracker;
        logger.info("🔧 RespTcpServer initialized, waiting for application ready event...");
    }

    // ==================== Server Lifecycle ====================

    @EventListener
    public void startServerWhenReady(ApplicationReadyEvent event) {
        if (serverStarted) {
            return;
        }
        try {
            start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RespServerException.startupFailed("Interrupted while binding " + tcp.host() + ":" + tcp.port(), e);
        }
    }

    /**
     * Bind the server socket and start accepting connections.
     */
    public synchronized void start() throws InterruptedException {
        if (serverStarted) {
            return;
        }
        if (commandRegistry.size() == 0) {
            throw RespServerException.configurationError("No commands registered, refusing to start");
        }

        logger.info("🚀 Starting RESP server on {}:{}", tcp.host(), tcp.port());
        logger.info("📊 Server configuration: bossThreads={}, workerThreads={}, backlog={}, keepAlive={}, "
                        + "tcpNoDelay={}, readChunkSize={}, idleTimeout={}s",
                tcp.bossThreads(), tcp.effectiveWorkerThreads(), tcp.backlog(), tcp.keepAlive(),
                tcp.tcpNoDelay(), tcp.readChunkSize(), tcp.idleTimeoutSeconds());

        bossGroup = new NioEventLoopGroup(tcp.bossThreads());
        workerGroup = new NioEventLoopGroup(tcp.effectiveWorkerThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, tcp.backlog())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, tcp.keepAlive())
                .childOption(ChannelOption.TCP_NODELAY, tcp.tcpNoDelay())
                // Reads are requested explicitly by the session, one bounded chunk at a time
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(tcp.readChunkSize()))
                .handler(new LoggingHandler(LogLevel.INFO))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        setupPipeline(ch);
                    }
                });

            ChannelFuture future = bootstrap.bind(new InetSocketAddress(tcp.host(), tcp.port())).sync();
            serverChannel = future.channel();
            serverStarted = true;

            logger.info("🎉 RESP server listening on {}", serverChannel.localAddress());
            logger.info("📋 Commands: {}", commandRegistry);
        } catch (Exception e) {
            logger.error("💥 Failed to start RESP server on {}:{}", tcp.host(), tcp.port(), e);
            shutdownGroups();
            if (e instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            throw RespServerException.startupFailed("Failed to bind " + tcp.host() + ":" + tcp.port(), e);
        }
    }

    private void setupPipeline(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        logger.debug("🔧 Setting up pipeline for channel: {}", channel.remoteAddress());

        // 1. Idle State Handler (optional)
        if (tcp.idleTimeoutEnabled()) {
            pipeline.addLast("idleState", new IdleStateHandler(0, 0, tcp.idleTimeoutSeconds(), TimeUnit.SECONDS));
        }

        // 2. Reply Encoder - shared, sits before the session so its writes pass through it
        pipeline.addLast("replyEncoder", replyEncoder);

        // 3. Session - new instance per channel
        pipeline.addLast("session", sessionProvider.getObject());

        logger.debug("✅ Pipeline configured: {}", pipeline.names());
    }

    /**
     * Shutdown the server gracefully
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!serverStarted) {
            return;
        }

        logger.info("🛑 Shutting down RESP server...");
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            connectionTracker.closeAll().awaitUninterruptibly(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            logger.warn("⚠️ Interrupted while closing server channel", e);
            Thread.currentThread().interrupt();
        } finally {
            shutdownGroups();
            serverStarted = false;
            logger.info("✅ RESP server shutdown completed");
        }
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    // ==================== Introspection ====================

    public boolean isRunning() {
        return serverStarted;
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int localPort() {
        if (!serverStarted || serverChannel == null) {
            throw new IllegalStateException("Server is not running");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
