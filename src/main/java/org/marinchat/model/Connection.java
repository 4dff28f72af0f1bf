package org.marinchat.model;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Identité d'une connexion WebSocket vivante.
 * <p>
 * {@code connectionId} reste null tant que le registre ne l'a pas attribué.
 */
@Value
public class Connection {
    @With
    String connectionId;
    String displayName;
    Instant joinedAt;

    public static Connection pending(String displayName, Instant joinedAt) {
        return new Connection(null, displayName, joinedAt);
    }
}
