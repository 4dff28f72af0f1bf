package org.marinchat.service.ws;

import org.marinchat.model.Connection;

public record Subscriber(Connection connection, EventSink sink) {

    public String connectionId() {
        return connection.getConnectionId();
    }
}
