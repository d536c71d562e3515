package com.wheelseye.respserver.protocol.resp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One complete command decoded from the wire: the command name followed by its arguments.
 *
 * Elements decoded from a RESP null bulk string ({@code $-1}) are kept as {@code null}
 * so that "missing" stays distinguishable from "empty".
 */
public record CommandFrame(List<String> arguments) {

    public CommandFrame {
        // List.copyOf rejects nulls, absent elements are legal here
        arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static CommandFrame of(String... arguments) {
        return new CommandFrame(Arrays.asList(arguments));
    }

    public static CommandFrame empty() {
        return new CommandFrame(List.of());
    }

    public boolean isEmpty() {
        return arguments.isEmpty();
    }

    public int size() {
        return arguments.size();
    }

    // Command name (first element), empty for an empty frame or a null first element
    public Optional<String> name() {
        return isEmpty() ? Optional.empty() : Optional.ofNullable(arguments.get(0));
    }

    // Everything after the command name
    public List<String> tail() {
        return isEmpty() ? List.of() : arguments.subList(1, arguments.size());
    }

    @Override
    public String toString() {
        return "CommandFrame" + arguments;
    }
}
