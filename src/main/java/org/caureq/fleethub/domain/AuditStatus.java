package org.caureq.fleethub.domain;

public enum AuditStatus {
    PENDING, SUCCEEDED, FAILED, TIMED_OUT;

    public boolean isTerminal() { return this != PENDING; }
}
