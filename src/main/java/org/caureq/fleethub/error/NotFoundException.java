package org.caureq.fleethub.error;

public class NotFoundException extends HubException {
    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException agent(String agentId) {
        return new NotFoundException("agent not found: " + agentId);
    }
}
