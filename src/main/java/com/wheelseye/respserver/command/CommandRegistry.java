package com.wheelseye.respserver.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable name to handler lookup, built once from every {@link CommandHandler} bean.
 *
 * Shared read-only by all connections, so lookups need no locking.
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, CommandHandler> handlers;

    public CommandRegistry(List<CommandHandler> commandHandlers) {
        Map<String, CommandHandler> byName = new HashMap<>();
        for (CommandHandler handler : commandHandlers) {
            Assert.notNull(handler, "Command handler cannot be null");
            String name = normalize(handler.name());
            CommandHandler previous = byName.putIfAbsent(name, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate command '" + name + "': "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        this.handlers = Map.copyOf(byName);
        log.info("✅ Registered {} commands: {}", handlers.size(), this);
    }

    // PING and ECHO, for use outside a Spring context
    public static CommandRegistry defaults() {
        return new CommandRegistry(List.of(new PingCommand(), new EchoCommand()));
    }

    // Case-insensitive lookup
    public Optional<CommandHandler> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(handlers.get(normalize(name)));
    }

    public Set<String> getRegisteredCommands() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return handlers.keySet().stream().sorted().collect(Collectors.joining(", ", "[", "]"));
    }
}
