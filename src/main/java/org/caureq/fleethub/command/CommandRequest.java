package org.caureq.fleethub.command;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/** A command as submitted by an API client. {@code params} are passed to the agent untouched. */
public record CommandRequest(@NotBlank String type, String target, Map<String, String> params) {
    public CommandRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public CommandType commandType() {
        return CommandType.parse(type);
    }
}
