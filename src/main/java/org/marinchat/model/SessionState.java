package org.marinchat.model;

public enum SessionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED; // terminal

    public boolean acceptsEvents() {
        return this == CONNECTING || this == OPEN;
    }
}
