package com.wheelseye.respserver.command;

import com.wheelseye.respserver.protocol.resp.ReplyValue;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * PING [message]
 *
 * Without arguments replies {@code +PONG}; otherwise echoes the first argument back
 * as a bulk string and ignores the rest.
 */
@Component
public class PingCommand implements CommandHandler {

    static final String PONG = "PONG";

    @Override
    public String name() {
        return "PING";
    }

    @Override
    public ReplyValue execute(List<String> arguments) {
        if (arguments.isEmpty()) {
            return ReplyValue.simple(PONG);
        }
        return ReplyValue.bulk(arguments.get(0));
    }
}
