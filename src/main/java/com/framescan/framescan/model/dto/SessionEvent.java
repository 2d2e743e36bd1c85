package com.framescan.framescan.model.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outbound message pushed to a session's connection. The {@code type}
 * discriminator is serialized first so clients can switch on it.
 */
@JsonPropertyOrder({ "type" })
public abstract class SessionEvent {

    public static final String CONNECTION_ESTABLISHED = "connection_established";
    public static final String VIDEO_INFO = "video_info";
    public static final String CLASSIFICATION = "classification";
    public static final String ERROR = "error";
    public static final String PING = "ping";

    public abstract String getType();
}
