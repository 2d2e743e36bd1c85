package com.framescan.framescan.model.dto;

import lombok.Getter;

@Getter
public class ErrorEvent extends SessionEvent {

    private final String message;

    public ErrorEvent(String message) {
        this.message = message;
    }

    @Override
    public String getType() {
        return ERROR;
    }
}
