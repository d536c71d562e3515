package com.wheelseye.respserver.protocol.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Stateless RESP reply encoding.
 *
 * Reply formats:
 * <pre>
 * Simple string   +TEXT\r\n
 * Error           -ERR message\r\n
 * Bulk string     $len\r\ndata\r\n      (len = UTF-8 byte count of data)
 * Null bulk       $-1\r\n
 * </pre>
 */
public final class RespEncoder {

    static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final String ERROR_PREFIX = "-ERR ";

    private RespEncoder() {
    }

    public static byte[] encode(ReplyValue reply) {
        if (reply instanceof ReplyValue.SimpleString simple) {
            return encodeSimpleString(simple.text());
        }
        if (reply instanceof ReplyValue.BulkString bulk) {
            return bulk.isNull() ? NULL_BULK.clone() : encodeBulkString(bulk.value().get());
        }
        if (reply instanceof ReplyValue.ErrorReply error) {
            return encodeError(error.message());
        }
        throw new IllegalArgumentException("Unsupported reply type: " + reply);
    }

    public static byte[] encodeSimpleString(String text) {
        return line("+" + text);
    }

    public static byte[] encodeError(String message) {
        return line(ERROR_PREFIX + message);
    }

    public static byte[] encodeBulkString(String value) {
        return encodeBulkString(Optional.ofNullable(value));
    }

    public static byte[] encodeBulkString(Optional<String> value) {
        if (value.isEmpty()) {
            return NULL_BULK.clone();
        }
        // Length prefix counts bytes, not chars; a mismatch misaligns the client's reader
        byte[] payload = value.get().getBytes(StandardCharsets.UTF_8);
        byte[] header = line("$" + payload.length);

        ByteArrayOutputStream out = new ByteArrayOutputStream(header.length + payload.length + CRLF.length);
        out.writeBytes(header);
        out.writeBytes(payload);
        out.writeBytes(CRLF);
        return out.toByteArray();
    }

    private static byte[] line(String text) {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[body.length + CRLF.length];
        System.arraycopy(body, 0, out, 0, body.length);
        System.arraycopy(CRLF, 0, out, body.length, CRLF.length);
        return out;
    }
}
