package org.marinchat.service.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.config.ChatProperties;
import org.marinchat.dto.ChatEvent;
import org.marinchat.dto.InboundFrame;
import org.marinchat.model.Connection;
import org.marinchat.model.SessionState;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Règles métier des sessions de chat : ouverture (welcome + join), trames
 * entrantes, minuterie d'inactivité, fermeture (leave).
 */
@Slf4j
@Service
public class ChatSessionService implements ConnectionSession.Lifecycle {

    public static final String SESSION_ATTRIBUTE = ConnectionSession.class.getName();

    static final CloseStatus IDLE_TIMEOUT = CloseStatus.GOING_AWAY.withReason("Idle timeout");
    static final CloseStatus SHUTDOWN = CloseStatus.GOING_AWAY.withReason("Server shutting down");

    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final IdleTimeouts timeouts;
    private final ObjectMapper objectMapper;
    private final ExecutorService wsWriterExecutor;
    private final ChatProperties props;
    private final Clock clock;

    public ChatSessionService(ConnectionRegistry registry,
                              BroadcastHub hub,
                              IdleTimeouts timeouts,
                              ObjectMapper objectMapper,
                              ExecutorService wsWriterExecutor,
                              ChatProperties props,
                              Clock clock) {
        this.registry = registry;
        this.hub = hub;
        this.timeouts = timeouts;
        this.objectMapper = objectMapper;
        this.wsWriterExecutor = wsWriterExecutor;
        this.props = props;
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Ouverture

    /**
     * Connecting → Open : enregistrement, abonnement au topic, welcome privé
     * puis join diffusé. Le nouvel arrivant est abonné avant le join, il le
     * reçoit donc une fois, juste après son welcome.
     */
    public ConnectionSession open(WebSocketSession transport, String displayName) {
        ChatProperties.Ws ws = props.getWs();
        ConnectionSession session = new ConnectionSession(transport, objectMapper, ws, clock, this);
        transport.getAttributes().put(SESSION_ATTRIBUTE, session);

        String topic = props.getTopic();
        String id = registry.register(Connection.pending(displayName, clock.instant()), session);
        Connection connection = registry.find(id).orElseThrow();
        registry.subscribe(id, topic);
        session.open(connection);
        session.start(wsWriterExecutor);
        // pas d'écrivain : déjà fermée, donc ni welcome ni join
        if (session.getState() == SessionState.CLOSED) return session;
        touch(session);
        timeouts.scheduleAtFixedRate(id, IdleTimeouts.PING, ws.effectivePingInterval(), session::requestPing);

        // verrou partagé avec closed() : un leave n'est jamais publié sans son join
        synchronized (session) {
            if (!session.getState().acceptsEvents()) timeouts.cancel(id, IdleTimeouts.PING);
            if (session.getState() == SessionState.CLOSED) return session;
            session.sendPrivate(ChatEvent.welcome(displayName));
            hub.publish(topic, ChatEvent.join(displayName));
            session.markJoined();
        }
        hub.publishUserList(topic);

        log.info("{} connected ({}), {} online", displayName, id, registry.size());
        return session;
    }

    // ------------------------------------------------------------------
    // Entrant

    public void handleFrame(ConnectionSession session, String payload) {
        if (session.getState() != SessionState.OPEN) return;
        touch(session);

        InboundFrame frame = decode(payload);
        if (frame == null || frame.getType() == null) {
            rejectMalformed(session, payload);
            return;
        }

        switch (frame.getType()) {
            case "chat" -> {
                String content = frame.getContent();
                if (content == null || content.isBlank()) {
                    rejectMalformed(session, payload);
                    return;
                }
                String username = session.getConnection().getDisplayName();
                log.debug("message from {}: {}", username, content);
                hub.publish(props.getTopic(), ChatEvent.chat(username, content));
            }
            case "user_list" -> session.sendPrivate(ChatEvent.userList(registry.displayNames(props.getTopic())));
            default -> log.debug("ignoring frame type '{}' from {}", frame.getType(), session.describe());
        }
    }

    public void touch(ConnectionSession session) {
        String id = session.getConnectionId();
        if (id == null || !session.getState().acceptsEvents()) return;
        timeouts.schedule(id, IdleTimeouts.IDLE, props.getWs().getIdleTimeout(), () -> idleExpired(session));
    }

    public void transportFailed(ConnectionSession session, Throwable error) {
        log.debug("transport error for {}: {}", session.describe(), error.toString());
        session.beginClose(CloseStatus.SESSION_NOT_RELIABLE);
    }

    public void transportClosed(ConnectionSession session, CloseStatus status) {
        session.transportClosed(status);
    }

    private InboundFrame decode(String payload) {
        if (payload == null) return null;
        try {
            return objectMapper.readValue(payload, InboundFrame.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void rejectMalformed(ConnectionSession session, String payload) {
        log.warn("invalid frame from {}: {}", session.describe(), abbreviate(payload));
        session.sendPrivate(ChatEvent.invalidFormat());
    }

    private void idleExpired(ConnectionSession session) {
        if (session.beginClose(IDLE_TIMEOUT)) {
            log.info("closing idle connection {}", session.describe());
        }
    }

    // ------------------------------------------------------------------
    // Fermeture

    @Override
    public void closing(ConnectionSession session) {
        String id = session.getConnectionId();
        if (id == null) return;
        timeouts.cancel(id, IdleTimeouts.IDLE);
        timeouts.cancel(id, IdleTimeouts.PING);
        timeouts.schedule(id, IdleTimeouts.GRACE, props.getWs().getCloseGracePeriod(), () -> forceClose(session));
    }

    // close() peut bloquer derrière un envoi en cours : jamais sur le thread des minuteries
    private void forceClose(ConnectionSession session) {
        try {
            wsWriterExecutor.execute(session::forceClose);
        } catch (RejectedExecutionException e) {
            session.forceClose();
        }
    }

    /**
     * Closing → Closed. Le leave n'est publié que par l'appel qui a réellement
     * retiré la connexion du registre.
     */
    @Override
    public void closed(ConnectionSession session) {
        String id = session.getConnectionId();
        if (id == null) return;
        timeouts.cancelAllOf(id);
        if (!registry.unregister(id)) return;

        String username = session.getConnection().getDisplayName();
        synchronized (session) {
            if (!session.hasJoined()) {
                log.debug("{} closed before joining, no leave", session.describe());
                return;
            }
        }

        String topic = props.getTopic();
        hub.publish(topic, ChatEvent.leave(username));
        hub.publishUserList(topic);

        CloseStatus status = session.getCloseStatus();
        log.info("{} disconnected ({}: {}), {} online", username,
                status != null ? status.getCode() : "-",
                status != null && status.getReason() != null ? status.getReason() : "",
                registry.size());
    }

    @PreDestroy
    public void closeAll() {
        for (Subscriber s : registry.snapshotAll()) {
            s.sink().terminate(SHUTDOWN);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() > 120 ? s.substring(0, 120) + "..." : s;
    }
}
