package org.marinchat.service.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.config.ChatProperties;
import org.marinchat.dto.ChatEvent;
import org.marinchat.model.Connection;
import org.marinchat.model.SessionState;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Acteur d'une connexion : état, file sortante bornée et unique écrivain.
 * <p>
 * Seule la tâche {@link #drain()} écrit sur le transport, pings compris. La
 * seule exception est {@link #forceClose()}, appelée quand le délai de grâce
 * expire alors que l'écrivain est bloqué.
 */
@Slf4j
public class ConnectionSession implements EventSink {

    public interface Lifecycle {
        /** La session vient de passer en CLOSING. */
        void closing(ConnectionSession session);

        /** La session vient de passer en CLOSED (une seule fois). */
        void closed(ConnectionSession session);
    }

    private static final long POLL_MILLIS = 100;

    private final WebSocketSession transport;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<ChatEvent> outbound;
    private final boolean closeOnOverflow;
    private final Duration closeGracePeriod;
    private final Clock clock;
    private final Lifecycle lifecycle;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean pingRequested = new AtomicBoolean();
    private volatile Connection connection;
    private volatile boolean transportClosed;
    private volatile long closingDeadlineNanos;
    private volatile boolean joined;

    public ConnectionSession(WebSocketSession transport,
                             ObjectMapper objectMapper,
                             ChatProperties.Ws settings,
                             Clock clock,
                             Lifecycle lifecycle) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.outbound = new ArrayBlockingQueue<>(settings.getOutboundQueueCapacity());
        this.closeOnOverflow = settings.isCloseOnOverflow();
        this.closeGracePeriod = settings.getCloseGracePeriod();
        this.clock = clock;
        this.lifecycle = lifecycle;
    }

    // ------------------------------------------------------------------
    // Cycle de vie

    public void open(Connection registered) {
        this.connection = registered;
        state.compareAndSet(SessionState.CONNECTING, SessionState.OPEN);
    }

    public void start(Executor writerExecutor) {
        try {
            writerExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("no writer available for {}, closing", describe());
            closeStatus.compareAndSet(null, CloseStatus.SERVICE_OVERLOAD);
            closeTransport();
            finish();
        }
    }

    /**
     * OPEN (ou CONNECTING) → CLOSING. Ne bloque jamais : l'écrivain vide la
     * file puis ferme le transport.
     *
     * @return true si cet appel a déclenché la fermeture
     */
    public boolean beginClose(CloseStatus status) {
        if (!state.get().acceptsEvents()) return false;
        if (!closeStatus.compareAndSet(null, status)) return false;
        closingDeadlineNanos = System.nanoTime() + closeGracePeriod.toNanos();
        SessionState prev;
        do {
            prev = state.get();
            if (!prev.acceptsEvents()) return false;
        } while (!state.compareAndSet(prev, SessionState.CLOSING));
        lifecycle.closing(this);
        return true;
    }

    /** Le client a fermé (ou le transport est mort) : plus rien à écrire. */
    public void transportClosed(CloseStatus status) {
        transportClosed = true;
        closeStatus.compareAndSet(null, status);
        finish();
    }

    /**
     * Délai de grâce écoulé : on coupe, même si l'écrivain est bloqué. Le
     * registre est libéré avant l'appel à close(), qui peut attendre la fin
     * d'un envoi en cours.
     */
    public void forceClose() {
        if (state.get() == SessionState.CLOSED) return;
        log.debug("grace period elapsed for {}, forcing close", describe());
        finish();
        closeTransport();
    }

    @Override
    public void terminate(CloseStatus status) {
        beginClose(status);
    }

    private void finish() {
        if (state.getAndSet(SessionState.CLOSED) == SessionState.CLOSED) return;
        outbound.clear();
        lifecycle.closed(this);
    }

    // ------------------------------------------------------------------
    // File sortante

    @Override
    public Delivery offer(ChatEvent event) {
        if (!state.get().acceptsEvents()) return Delivery.CLOSED;
        return outbound.offer(event) ? Delivery.QUEUED : Delivery.QUEUE_FULL;
    }

    /** Event privé (welcome, erreur...) : jamais diffusé aux autres. */
    public boolean sendPrivate(ChatEvent event) {
        ChatEvent stamped = (event.getTimestamp() == null) ? event.withTimestamp(clock.millis()) : event;
        Delivery result = offer(stamped);
        if (result == Delivery.QUEUE_FULL) overflow();
        return result == Delivery.QUEUED;
    }

    /** Le prochain tour de l'écrivain enverra un ping. */
    public void requestPing() {
        if (state.get() == SessionState.OPEN) pingRequested.set(true);
    }

    @Override
    public void overflow() {
        long total = dropped.incrementAndGet();
        if (closeOnOverflow
                && beginClose(CloseStatus.SESSION_NOT_RELIABLE.withReason("Outbound queue full"))) {
            log.warn("closing {}: client too slow, {} event(s) dropped", describe(), total);
        }
    }

    /**
     * Boucle de l'écrivain unique : FIFO, jusqu'à CLOSED, ou jusqu'à ce que la
     * file soit vide / le délai de grâce écoulé une fois en CLOSING.
     */
    void drain() {
        try {
            while (true) {
                SessionState current = state.get();
                if (current == SessionState.CLOSED || transportClosed) break;
                if (current == SessionState.CLOSING
                        && (outbound.isEmpty() || System.nanoTime() - closingDeadlineNanos >= 0)) break;

                ChatEvent next = outbound.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (next != null) write(next);
                if (pingRequested.getAndSet(false) && state.get() == SessionState.OPEN) {
                    transport.sendMessage(new PingMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("write failed for {}: {}", describe(), e.getMessage());
            closeStatus.compareAndSet(null, CloseStatus.SESSION_NOT_RELIABLE);
        } catch (RuntimeException e) {
            log.error("writer crashed for {}", describe(), e);
            closeStatus.compareAndSet(null, CloseStatus.SERVER_ERROR);
        } finally {
            closeTransport();
            finish();
        }
    }

    private void write(ChatEvent event) throws IOException {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("cannot serialize {} event for {}", event.getType(), describe(), e);
            return;
        }
        transport.sendMessage(new TextMessage(json));
    }

    private void closeTransport() {
        if (transportClosed || !transport.isOpen()) return;
        CloseStatus status = closeStatus.get();
        try {
            transport.close(status != null ? status : CloseStatus.NORMAL);
        } catch (IOException | RuntimeException e) {
            log.debug("close failed for {}: {}", describe(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------

    public Connection getConnection() {
        return connection;
    }

    public String getConnectionId() {
        Connection c = connection;
        return c != null ? c.getConnectionId() : null;
    }

    public SessionState getState() {
        return state.get();
    }

    public CloseStatus getCloseStatus() {
        return closeStatus.get();
    }

    void markJoined() {
        joined = true;
    }

    /** Le join de cette connexion a été diffusé. */
    public boolean hasJoined() {
        return joined;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int pendingCount() {
        return outbound.size();
    }

    public String describe() {
        Connection c = connection;
        return c != null ? c.getDisplayName() + " (" + c.getConnectionId() + ")" : "session " + transport.getId();
    }
}
