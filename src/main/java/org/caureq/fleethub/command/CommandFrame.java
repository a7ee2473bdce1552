package org.caureq.fleethub.command;

import java.util.Map;

/** Payload of the {@code command} frame sent to an agent. */
public record CommandFrame(String commandId, String type, String target, Map<String, String> params, long timeoutMs) {}
