package org.caureq.fleethub.error;

public class StorageException extends HubException {
    public StorageException(String message) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
