package com.wheelseye.respserver.command;

import com.wheelseye.respserver.protocol.resp.CommandFrame;
import com.wheelseye.respserver.protocol.resp.ReplyValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes a decoded frame to its handler.
 *
 * Empty and unknown commands become error replies; the connection stays usable.
 * Exceptions thrown by a handler are not caught here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    static final String EMPTY_COMMAND = "empty command";

    private final CommandRegistry registry;

    public ReplyValue dispatch(CommandFrame frame) {
        Optional<String> name = frame.name();
        if (name.isEmpty()) {
            return ReplyValue.error(EMPTY_COMMAND);
        }

        Optional<CommandHandler> handler = registry.find(name.get());
        if (handler.isEmpty()) {
            log.debug("❓ Unknown command '{}'", name.get());
            return ReplyValue.error("unknown command '" + sanitize(name.get()) + "'");
        }

        log.debug("⚙️ Executing {} with {} argument(s)", handler.get().name(), frame.size() - 1);
        return handler.get().execute(frame.tail());
    }

    // Error replies are single-line
    private static String sanitize(String name) {
        return name.replace('\r', ' ').replace('\n', ' ');
    }
}
