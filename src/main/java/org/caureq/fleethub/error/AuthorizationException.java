package org.caureq.fleethub.error;

import java.util.Map;

public class AuthorizationException extends HubException {

    public enum Reason { INVISIBLE, INSUFFICIENT_LEVEL, ELEVATION_REQUIRED, SUPERADMIN_REQUIRED }

    private final Reason reason;

    public AuthorizationException(Reason reason, String message) {
        super(reason == Reason.INVISIBLE ? ErrorCode.NOT_FOUND : ErrorCode.PERMISSION_DENIED, message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }

    @Override
    public Map<String, Object> details() {
        // an invisible agent must look exactly like a missing one
        return reason == Reason.INVISIBLE ? Map.of() : Map.of("reason", reason.name());
    }
}
