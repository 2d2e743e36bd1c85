package com.framescan.framescan.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Client to server envelope. Only {@code type} is required; {@code timestamp}
 * is read for {@code process_frame}. Anything else is ignored.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {

    public static final String PROCESS_FRAME = "process_frame";
    public static final String CONNECT = "connect";
    public static final String PONG = "pong";

    private String type;
    private Double timestamp;
}
