package com.molcollab.model;

import com.molcollab.dto.ServerMessage;

/**
 * Outbound side of a participant's connection.
 */
@FunctionalInterface
public interface SessionSink {
    void send(ServerMessage message);
}
