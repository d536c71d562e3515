package com.wheelseye.respserver.handler;

import com.wheelseye.respserver.command.CommandDispatcher;
import com.wheelseye.respserver.config.RespServerProperties;
import com.wheelseye.respserver.exception.RespProtocolException;
import com.wheelseye.respserver.helper.ConnectionTracker;
import com.wheelseye.respserver.protocol.resp.CommandFrame;
import com.wheelseye.respserver.protocol.resp.ReplyValue;
import com.wheelseye.respserver.protocol.resp.RespFrameParser;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Per-connection RESP session: read → parse → dispatch → encode → write.
 *
 * The channel runs with auto-read disabled. After each chunk the session writes the
 * replies one at a time, waits for every write to complete, and only then asks for
 * the next read, so at most one reply is in flight per connection.
 *
 * Any protocol fault closes the connection; frames decoded before the fault are still
 * answered, the faulted one never is.
 */
@Slf4j
@Component
@Scope("prototype")
// Each channel must get a new instance | the frame parser buffers bytes for exactly one connection
public class RespConnectionSession extends ChannelInboundHandlerAdapter {

    private final CommandDispatcher dispatcher;
    private final ConnectionTracker connectionTracker;
    private final RespServerProperties.Protocol limits;

    private RespFrameParser parser;

    public RespConnectionSession(CommandDispatcher dispatcher, ConnectionTracker connectionTracker,
                                 RespServerProperties properties) {
        this.dispatcher = dispatcher;
        this.connectionTracker = connectionTracker;
        this.limits = properties.protocol();
    }

    // ==================== Channel lifecycle ====================

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        parser = new RespFrameParser(limits);
        connectionTracker.register(ctx.channel());
        log.info("🔗 Client connected: {} (Active: {})",
                ctx.channel().remoteAddress(), connectionTracker.getActiveConnectionCount());

        ctx.read();
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (parser != null) {
            if (parser.bufferedBytes() > 0) {
                log.debug("🧹 Discarding {} unparsed byte(s) from {}", parser.bufferedBytes(),
                        ctx.channel().remoteAddress());
            }
            parser.release();
        }
        connectionTracker.unregister(ctx.channel());
        log.info("📵 Client disconnected: {} (Active: {})",
                ctx.channel().remoteAddress(), connectionTracker.getActiveConnectionCount());

        super.channelInactive(ctx);
    }

    // ==================== Inbound data ====================

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf chunk)) {
            ctx.fireChannelRead(msg);
            return;
        }

        List<CommandFrame> frames;
        RespProtocolException fault = null;
        try {
            log.debug("📥 Received {} bytes from {}", chunk.readableBytes(), ctx.channel().remoteAddress());
            frames = parser.feed(chunk);
        } catch (RespProtocolException e) {
            fault = e;
            frames = e.framesBeforeFault();
        } finally {
            chunk.release();
        }

        replyInOrder(ctx, frames.iterator(), fault);
    }

    /**
     * Dispatch and write one frame, continue with the next once the write has completed.
     */
    private void replyInOrder(ChannelHandlerContext ctx, Iterator<CommandFrame> frames, RespProtocolException fault) {
        if (!frames.hasNext()) {
            if (fault != null) {
                log.warn("🚫 {} from {}, closing connection", fault.getMessage(), ctx.channel().remoteAddress());
                ctx.close();
            } else if (ctx.channel().isActive()) {
                ctx.read();
            }
            return;
        }

        CommandFrame frame = frames.next();
        ReplyValue reply;
        try {
            reply = dispatcher.dispatch(frame);
        } catch (RuntimeException e) {
            log.error("❌ Command {} failed for {}: {}", frame.name().orElse("?"),
                    ctx.channel().remoteAddress(), e.getMessage(), e);
            ctx.close();
            return;
        }

        ctx.writeAndFlush(reply).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                replyInOrder(ctx, frames, fault);
            } else {
                log.warn("⚠️ Failed to write reply to {}: {}", ctx.channel().remoteAddress(),
                        future.cause() != null ? future.cause().getMessage() : "unknown error");
                ctx.close();
            }
        });
    }

    // ==================== Events & errors ====================

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle) {
            log.info("⏰ Closing idle connection {} ({})", ctx.channel().remoteAddress(), idle.state());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            // Reset by peer, broken pipe: the client is gone, not a server fault
            log.info("🔌 Transport failure on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("❌ Handler exception from {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        }
        ctx.close();
    }
}
