package com.wheelseye.respserver.command;

import com.wheelseye.respserver.protocol.resp.ReplyValue;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ECHO message [message ...]
 *
 * Replies with all arguments joined by a single space, or a null bulk string when
 * called without arguments.
 */
@Component
public class EchoCommand implements CommandHandler {

    @Override
    public String name() {
        return "ECHO";
    }

    @Override
    public ReplyValue execute(List<String> arguments) {
        if (arguments.isEmpty()) {
            return ReplyValue.nullBulk();
        }
        String joined = arguments.stream()
                .map(argument -> Objects.toString(argument, ""))
                .collect(Collectors.joining(" "));
        return ReplyValue.bulk(joined);
    }
}
