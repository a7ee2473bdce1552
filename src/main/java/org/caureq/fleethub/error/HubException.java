package org.caureq.fleethub.error;

import java.util.Map;

/**
 * Base of every failure the hub reports to a caller. Each subtype maps to one {@link ErrorCode}
 * and from there to one HTTP status.
 */
public abstract class HubException extends RuntimeException {
    private final ErrorCode code;

    protected HubException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected HubException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() { return code; }

    /** Extra fields rendered into {@code ApiError.details}. */
    public Map<String, Object> details() { return Map.of(); }
}
