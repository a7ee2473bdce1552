package org.caureq.fleethub.permission;

import org.caureq.fleethub.error.ValidationException;

public enum PermissionLevel {
    READ_ONLY(0),
    BASIC_WRITE(1),
    SERVICE_CONTROL(2),
    SYSTEM_ADMIN(3);

    private final int value;

    PermissionLevel(int value) { this.value = value; }

    public int value() { return value; }

    public boolean atLeast(PermissionLevel other) { return value >= other.value; }

    public static PermissionLevel of(int value) {
        for (var l : values()) {
            if (l.value == value) return l;
        }
        throw new ValidationException("permission level must be between 0 and 3, got " + value);
    }
}
