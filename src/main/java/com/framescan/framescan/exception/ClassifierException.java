package com.framescan.framescan.exception;

public class ClassifierException extends RuntimeException {

    public ClassifierException(String message) {
        super(message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
