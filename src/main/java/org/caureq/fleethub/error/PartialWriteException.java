package org.caureq.fleethub.error;

import java.util.List;
import java.util.Map;

/**
 * Some measurement families of a snapshot were persisted and others were not.
 * Families already written are not rolled back.
 */
public class PartialWriteException extends StorageException {
    private final List<String> written;
    private final List<String> failed;

    public PartialWriteException(String agentId, List<String> written, List<String> failed, Throwable cause) {
        super("partial write for agent " + agentId + ": failed " + failed + ", written " + written, cause);
        this.written = List.copyOf(written);
        this.failed = List.copyOf(failed);
    }

    public List<String> written() { return written; }
    public List<String> failed() { return failed; }

    @Override
    public Map<String, Object> details() {
        return Map.of("written", written, "failed", failed);
    }
}
