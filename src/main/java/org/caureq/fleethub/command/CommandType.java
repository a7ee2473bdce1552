package org.caureq.fleethub.command;

import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.permission.PermissionLevel;

import java.util.Locale;

import static org.caureq.fleethub.permission.PermissionLevel.BASIC_WRITE;
import static org.caureq.fleethub.permission.PermissionLevel.READ_ONLY;
import static org.caureq.fleethub.permission.PermissionLevel.SERVICE_CONTROL;
import static org.caureq.fleethub.permission.PermissionLevel.SYSTEM_ADMIN;

public enum CommandType {
    PROCESS_LIST(READ_ONLY),
    SERVICE_STATUS(READ_ONLY),
    DOCKER_LIST(READ_ONLY),
    FILE_TAIL(READ_ONLY),

    FILE_DOWNLOAD(BASIC_WRITE),
    FILE_TRUNCATE(BASIC_WRITE),
    DOCKER_LOGS(BASIC_WRITE),

    PROCESS_KILL(SERVICE_CONTROL),
    SERVICE_START(SERVICE_CONTROL),
    SERVICE_STOP(SERVICE_CONTROL),
    SERVICE_RESTART(SERVICE_CONTROL),
    DOCKER_START(SERVICE_CONTROL),
    DOCKER_STOP(SERVICE_CONTROL),
    DOCKER_RESTART(SERVICE_CONTROL),
    FILE_UPLOAD(SERVICE_CONTROL),

    SYSTEM_REBOOT(SYSTEM_ADMIN),
    SHELL_EXECUTE(SYSTEM_ADMIN);

    private final PermissionLevel requiredLevel;

    CommandType(PermissionLevel requiredLevel) {
        this.requiredLevel = requiredLevel;
    }

    public PermissionLevel requiredLevel() { return requiredLevel; }

    /** SYSTEM_ADMIN commands need a fresh elevated credential on top of the level. */
    public boolean requiresElevation() {
        return requiredLevel == SYSTEM_ADMIN;
    }

    /** Accepts {@code SERVICE_RESTART}, {@code service_restart} or {@code service-restart}. */
    public static CommandType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new ValidationException("command type is required");
        try {
            return valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown command type: " + raw);
        }
    }
}
