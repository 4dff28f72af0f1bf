package org.marinchat.service.ws;

import org.marinchat.dto.ChatEvent;
import org.springframework.web.socket.CloseStatus;

/**
 * Côté sortant d'une connexion, tel que le voient le registre et le hub.
 * Aucune méthode ne doit bloquer sur le réseau.
 */
public interface EventSink {

    enum Delivery {
        QUEUED,
        QUEUE_FULL,
        CLOSED
    }

    Delivery offer(ChatEvent event);

    /** Appelé par le hub quand un event a été jeté faute de place. */
    void overflow();

    void terminate(CloseStatus status);
}
