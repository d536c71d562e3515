package com.wheelseye.respserver.helper;

import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe registry of open client connections.
 *
 * Backed by a Netty {@link ChannelGroup}, which drops channels on its own once they
 * close. Used for connection statistics and to close every client on shutdown.
 */
@Slf4j
@Component
public class ConnectionTracker {

    private final ChannelGroup channels = new DefaultChannelGroup("resp-clients", GlobalEventExecutor.INSTANCE);
    private final AtomicLong totalAccepted = new AtomicLong();

    public void register(Channel channel) {
        if (channel == null) {
            log.warn("⚠️ Attempt to register null channel");
            return;
        }
        if (channels.add(channel)) {
            totalAccepted.incrementAndGet();
            log.debug("📝 Registered connection {} (Active: {})", channel.id().asShortText(), channels.size());
        }
    }

    public void unregister(Channel channel) {
        if (channel != null && channels.remove(channel)) {
            log.debug("🗑️ Unregistered connection {} (Active: {})", channel.id().asShortText(), channels.size());
        }
    }

    public int getActiveConnectionCount() {
        return channels.size();
    }

    public ConnectionStats getStats() {
        return new ConnectionStats(channels.size(), totalAccepted.get());
    }

    /**
     * Close every tracked connection, e.g. during shutdown.
     */
    public ChannelGroupFuture closeAll() {
        log.info("🔌 Closing {} client connection(s)", channels.size());
        return channels.close();
    }

    public record ConnectionStats(int activeConnections, long totalAccepted) {}
}
