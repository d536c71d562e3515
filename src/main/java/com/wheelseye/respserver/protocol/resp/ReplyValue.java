package com.wheelseye.respserver.protocol.resp;

import java.util.Objects;
import java.util.Optional;

/**
 * Reply produced by a command handler, consumed immediately by {@link RespEncoder}.
 */
public sealed interface ReplyValue permits ReplyValue.SimpleString, ReplyValue.BulkString, ReplyValue.ErrorReply {

    static SimpleString simple(String text) {
        return new SimpleString(text);
    }

    static BulkString bulk(String text) {
        return new BulkString(Optional.ofNullable(text));
    }

    static BulkString nullBulk() {
        return new BulkString(Optional.empty());
    }

    static ErrorReply error(String message) {
        return new ErrorReply(message);
    }

    // +TEXT
    record SimpleString(String text) implements ReplyValue {
        public SimpleString {
            Objects.requireNonNull(text, "text");
            if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Simple string must not contain CR or LF");
            }
        }
    }

    // $len payload, or $-1 when absent
    record BulkString(Optional<String> value) implements ReplyValue {
        public BulkString {
            Objects.requireNonNull(value, "value");
        }

        public boolean isNull() {
            return value.isEmpty();
        }
    }

    // -ERR message
    record ErrorReply(String message) implements ReplyValue {
        public ErrorReply {
            Objects.requireNonNull(message, "message");
            if (message.indexOf('\r') >= 0 || message.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Error message must not contain CR or LF");
            }
        }
    }
}
