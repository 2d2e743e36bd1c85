package com.framescan.framescan.exception;

public class SessionException extends RuntimeException {

    private final SessionError error;

    public SessionException(SessionError error) {
        super(error.getDefaultMessage());
        this.error = error;
    }

    public SessionException(SessionError error, String message) {
        super(message);
        this.error = error;
    }

    public SessionException(SessionError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public SessionError getError() {
        return error;
    }
}
