package com.framescan.framescan.service.session;

public enum SessionPhase {
    /** Video provisioned, no connection yet. */
    PENDING,
    CONNECTING,
    ATTACHING,
    STREAMING,
    CLOSED
}
