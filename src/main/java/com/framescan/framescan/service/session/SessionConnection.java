package com.framescan.framescan.service.session;

import java.io.IOException;

import com.framescan.framescan.model.dto.SessionEvent;

/**
 * Transport-neutral handle on a client connection. Implementations must allow
 * {@link #send} from several threads.
 */
public interface SessionConnection {

    String id();

    boolean isOpen();

    void send(SessionEvent event) throws IOException;

    void close();
}
