package com.framescan.framescan.model.dto;

public class PingEvent extends SessionEvent {

    @Override
    public String getType() {
        return PING;
    }
}
