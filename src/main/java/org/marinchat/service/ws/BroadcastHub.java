package org.marinchat.service.ws;

import lombok.extern.slf4j.Slf4j;
import org.marinchat.dto.ChatEvent;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Diffuse un event à tous les abonnés d'un topic.
 * <p>
 * Un publish = une section critique : horodatage, snapshot, puis dépôt dans
 * chaque file sortante. Deux publish successifs arrivent donc dans le même
 * ordre dans toutes les files. On ne fait qu'enfiler, jamais d'écriture réseau.
 */
@Slf4j
@Service
public class BroadcastHub {

    private final ConnectionRegistry registry;
    private final Clock clock;

    private final Object publishLock = new Object();
    private long lastTimestamp;
    private final AtomicLong dropped = new AtomicLong();

    public BroadcastHub(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * @return nombre de connexions dont la file a accepté l'event
     */
    public int publish(String topic, ChatEvent event) {
        return publish(topic, members -> event);
    }

    /**
     * Variante où l'event dépend des destinataires : il est construit dans la
     * section critique, à partir du même snapshot que la diffusion.
     */
    public int publish(String topic, Function<List<Subscriber>, ChatEvent> eventFor) {
        synchronized (publishLock) {
            List<Subscriber> members = registry.broadcastSnapshot(topic);

            long now = Math.max(clock.millis(), lastTimestamp);
            lastTimestamp = now;
            ChatEvent stamped = eventFor.apply(members).withTimestamp(now);

            int queued = 0;
            for (Subscriber member : members) {
                if (deliver(member, stamped)) queued++;
            }
            return queued;
        }
    }

    /** La liste publiée est exactement celle des destinataires. */
    public int publishUserList(String topic) {
        return publish(topic, members -> ChatEvent.userList(ConnectionRegistry.namesOf(members)));
    }

    public long droppedCount() {
        return dropped.get();
    }

    private boolean deliver(Subscriber member, ChatEvent event) {
        EventSink.Delivery result;
        try {
            result = member.sink().offer(event);
        } catch (RuntimeException e) {
            log.warn("offer failed for connection {}: {}", member.connectionId(), e.toString());
            result = EventSink.Delivery.CLOSED;
        }
        switch (result) {
            case QUEUED:
                return true;
            case QUEUE_FULL:
                dropped.incrementAndGet();
                log.warn("outbound queue full, dropping {} event for {} ({})",
                        event.getType().wire(), member.connection().getDisplayName(), member.connectionId());
                member.sink().overflow();
                return false;
            default:
                return false; // connexion en cours de fermeture
        }
    }
}
