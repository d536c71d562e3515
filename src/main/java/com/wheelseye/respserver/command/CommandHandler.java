package com.wheelseye.respserver.command;

import com.wheelseye.respserver.protocol.resp.ReplyValue;
import lombok.NonNull;

import java.util.List;

/**
 * A single server command. Implementations must be stateless: one instance serves
 * every connection concurrently.
 */
public interface CommandHandler {

    // Command name as clients send it, matched case-insensitively (e.g. "PING")
    @NonNull
    String name();

    /**
     * @param arguments everything after the command name; elements may be {@code null}
     *                  for RESP null bulk strings
     */
    @NonNull
    ReplyValue execute(List<String> arguments);
}
