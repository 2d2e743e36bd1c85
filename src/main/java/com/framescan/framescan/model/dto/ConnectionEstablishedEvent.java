package com.framescan.framescan.model.dto;

import lombok.Getter;

@Getter
public class ConnectionEstablishedEvent extends SessionEvent {

    private final String sessionId;

    public ConnectionEstablishedEvent(String sessionId) {
        this.sessionId = sessionId;
    }

    @Override
    public String getType() {
        return CONNECTION_ESTABLISHED;
    }
}
