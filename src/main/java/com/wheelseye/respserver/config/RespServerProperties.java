package com.wheelseye.respserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable RESP server configuration, bound from the {@code resp-server} prefix.
 */
@ConfigurationProperties(prefix = "resp-server")
public record RespServerProperties(
    @DefaultValue Tcp tcp,
    @DefaultValue Protocol protocol
) {

    public static RespServerProperties defaults() {
        return new RespServerProperties(Tcp.defaults(), Protocol.defaults());
    }

    // host – bind address, loopback unless overridden. (default: 127.0.0.1)
    // port – listening port, 0 picks an ephemeral port. (default: 6379)
    // bossThreads – threads accepting new connections. (default: 1)
    // workerThreads – I/O threads serving connected clients, 0 = available processors. (default: 0)
    // backlog – pending connections queued before new ones are refused. (default: 128)
    // keepAlive – TCP keep-alive on client sockets. (default: true)
    // tcpNoDelay – disables Nagle's algorithm so small replies go out immediately. (default: true)
    // readChunkSize – bytes requested from the socket per read. (default: 512)
    // idleTimeoutSeconds – closes connections without traffic for this long, 0 disables. (default: 0)
    public record Tcp(
        @DefaultValue("127.0.0.1") String host,
        @DefaultValue("6379") int port,
        @DefaultValue("1") int bossThreads,
        @DefaultValue("0") int workerThreads,
        @DefaultValue("128") int backlog,
        @DefaultValue("true") boolean keepAlive,
        @DefaultValue("true") boolean tcpNoDelay,
        @DefaultValue("512") int readChunkSize,
        @DefaultValue("0") int idleTimeoutSeconds
    ) {

        public Tcp {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Host must not be blank");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 0 and 65535, got: " + port);
            }
            if (bossThreads < 1) {
                throw new IllegalArgumentException("Boss threads must be at least 1, got: " + bossThreads);
            }
            if (workerThreads < 0) {
                throw new IllegalArgumentException("Worker threads cannot be negative, got: " + workerThreads);
            }
            if (backlog < 1) {
                throw new IllegalArgumentException("Backlog must be at least 1, got: " + backlog);
            }
            if (readChunkSize < 64) {
                throw new IllegalArgumentException("Read chunk size must be at least 64 bytes, got: " + readChunkSize);
            }
            if (idleTimeoutSeconds < 0) {
                throw new IllegalArgumentException("Idle timeout cannot be negative, got: " + idleTimeoutSeconds);
            }
        }

        public static Tcp defaults() {
            return new Tcp("127.0.0.1", 6379, 1, 0, 128, true, true, 512, 0);
        }

        /**
         * Get effective worker threads (0 means use available processors)
         */
        public int effectiveWorkerThreads() {
            return workerThreads == 0 ? Runtime.getRuntime().availableProcessors() : workerThreads;
        }

        public boolean idleTimeoutEnabled() {
            return idleTimeoutSeconds > 0;
        }
    }

    // maxInlineLength – longest inline command line (or unterminated header) accepted, in bytes. (default: 64 KiB)
    // maxBulkLength – largest declared bulk string payload, in bytes. (default: 512 MiB)
    // maxMultibulkLength – largest declared array element count. (default: 1048576)
    public record Protocol(
        @DefaultValue("65536") int maxInlineLength,
        @DefaultValue("536870912") int maxBulkLength,
        @DefaultValue("1048576") int maxMultibulkLength
    ) {

        public Protocol {
            if (maxInlineLength < 1) {
                throw new IllegalArgumentException("Max inline length must be positive, got: " + maxInlineLength);
            }
            if (maxBulkLength < 0) {
                throw new IllegalArgumentException("Max bulk length cannot be negative, got: " + maxBulkLength);
            }
            if (maxMultibulkLength < 0) {
                throw new IllegalArgumentException("Max multibulk length cannot be negative, got: " + maxMultibulkLength);
            }
        }

        public static Protocol defaults() {
            return new Protocol(65536, 536870912, 1048576);
        }
    }
}
