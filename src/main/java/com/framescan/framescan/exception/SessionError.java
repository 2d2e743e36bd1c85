package com.framescan.framescan.exception;

/**
 * Failure conditions surfaced by the session core. {@code fatal} marks the ones
 * after which a session's coordinator cannot make further progress.
 */
public enum SessionError {

    SESSION_NOT_FOUND("Session not found", true),
    VIDEO_NOT_FOUND("Video file not found for session", true),
    VIDEO_NOT_INITIALIZED("Video not initialized", true),
    VIDEO_UNREADABLE("Could not open video file", true),
    EMPTY_VIDEO("Video contains no readable frames", true),
    CLASSIFIER_UNAVAILABLE("Classifier is not available", true),
    VIDEO_CLOSED("Video handle is closed", true),
    FRAME_READ_ERROR("Could not read frame", false),
    CLASSIFICATION_FAILED("Frame classification failed", false);

    private final String defaultMessage;
    private final boolean fatal;

    SessionError(String defaultMessage, boolean fatal) {
        this.defaultMessage = defaultMessage;
        this.fatal = fatal;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isFatal() {
        return fatal;
    }
}
