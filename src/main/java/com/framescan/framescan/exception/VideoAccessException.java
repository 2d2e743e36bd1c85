package com.framescan.framescan.exception;

import java.io.IOException;

/**
 * Raised by a video source when opening, seeking or decoding fails.
 * {@link #isClosed()} is set when the handle had already been released.
 */
public class VideoAccessException extends IOException {

    private final boolean closed;

    public VideoAccessException(String message, Throwable cause) {
        super(message, cause);
        this.closed = false;
    }

    private VideoAccessException(String message, boolean closed) {
        super(message);
        this.closed = closed;
    }

    public static VideoAccessException closed(String source) {
        return new VideoAccessException("Video source already closed: " + source, true);
    }

    public boolean isClosed() {
        return closed;
    }
}
