package io.hearth.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structured call signalled by the model. {@code rawArguments} keeps the unparsed argument text
 * so malformed payloads can still be audited. Argument values may be {@code null}.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments, String rawArguments) {

    public ToolCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        rawArguments = rawArguments == null ? "" : rawArguments;
    }
}
