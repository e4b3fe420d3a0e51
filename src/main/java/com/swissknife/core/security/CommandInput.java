package com.swissknife.core.security;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A command as supplied by a caller: either a single string that still needs
 * word splitting, or a pre-tokenized argument list. Exactly one of the two
 * components is non-null.
 */
@JsonDeserialize(using = CommandInput.Deserializer.class)
public record CommandInput(String text, List<String> parts) {

    public static CommandInput of(String text) {
        return new CommandInput(text, null);
    }

    public static CommandInput of(List<String> parts) {
        return new CommandInput(null, List.copyOf(parts));
    }

    public static CommandInput of(String... parts) {
        return of(List.of(parts));
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * Best-effort argv used for the audit preview when the command cannot be
     * tokenized: the raw string as one token, or the list as given.
     */
    public List<String> fallbackArgv() {
        return isText() ? List.of(text) : parts;
    }

    @Override
    public String toString() {
        return isText() ? text : String.join(" ", parts);
    }

    /** Accepts a JSON string or a JSON array of scalars for {@code cmd}. */
    public static class Deserializer extends JsonDeserializer<CommandInput> {

        @Override
        public CommandInput deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            JsonNode node = parser.readValueAsTree();
            if (node.isTextual()) {
                return CommandInput.of(node.asText());
            }
            if (node.isArray()) {
                List<String> parts = new ArrayList<>();
                for (JsonNode element : node) {
                    parts.add(element.isTextual() ? element.asText() : element.toString());
                }
                return CommandInput.of(parts);
            }
            throw InvalidFormatException.from(parser,
                    "cmd must be a string or an array of strings", node, CommandInput.class);
        }
    }
}
