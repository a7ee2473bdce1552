package org.caureq.fleethub.error;

public class ConflictException extends HubException {
    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
