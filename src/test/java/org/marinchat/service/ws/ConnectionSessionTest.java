package org.marinchat.service.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.marinchat.config.ChatProperties;
import org.marinchat.dto.ChatEvent;
import org.marinchat.model.Connection;
import org.marinchat.model.SessionState;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConnectionSessionTest {

    @Mock
    private WebSocketSession transport;

    @Mock
    private ConnectionSession.Lifecycle lifecycle;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(7_000L), ZoneOffset.UTC);
    private ChatProperties.Ws settings;

    @BeforeEach
    void setUp() {
        settings = new ChatProperties().getWs();
        lenient().when(transport.isOpen()).thenReturn(true);
        lenient().when(transport.getId()).thenReturn("t-1");
    }

    private ConnectionSession openSession() {
        ConnectionSession session = new ConnectionSession(transport, objectMapper, settings, clock, lifecycle);
        session.open(Connection.pending("Alice", Instant.EPOCH).withConnectionId("c-1"));
        return session;
    }

    // --------------------------------------------------------------
    // États
    // --------------------------------------------------------------
    @Test
    void open_passeDeConnectingAOpen() {
        ConnectionSession session = new ConnectionSession(transport, objectMapper, settings, clock, lifecycle);
        assertThat(session.getState()).isEqualTo(SessionState.CONNECTING);

        session.open(Connection.pending("Alice", Instant.EPOCH).withConnectionId("c-1"));

        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        assertThat(session.getConnectionId()).isEqualTo("c-1");
    }

    @Test
    void beginClose_uneSeuleFois() {
        ConnectionSession session = openSession();

        assertThat(session.beginClose(CloseStatus.GOING_AWAY)).isTrue();
        assertThat(session.beginClose(CloseStatus.SERVER_ERROR)).isFalse();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSING);
        assertThat(session.getCloseStatus()).isEqualTo(CloseStatus.GOING_AWAY);
        verify(lifecycle, times(1)).closing(session);
    }

    @Test
    void closing_refuseLesNouveauxEvents() {
        ConnectionSession session = openSession();
        session.beginClose(CloseStatus.NORMAL);

        assertThat(session.offer(ChatEvent.chat("Bob", "late"))).isEqualTo(EventSink.Delivery.CLOSED);
    }

    @Test
    void transportClosed_fermeEtNotifieUneSeuleFois() {
        ConnectionSession session = openSession();
        session.offer(ChatEvent.chat("Bob", "pending"));

        session.transportClosed(CloseStatus.NORMAL);
        session.transportClosed(CloseStatus.NORMAL);
        session.forceClose();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(session.pendingCount()).isZero();
        verify(lifecycle, times(1)).closed(session);
    }

    // --------------------------------------------------------------
    // Écrivain
    // --------------------------------------------------------------
    @Test
    void drain_ecritEnFifoPuisFermeLeTransport() throws IOException {
        ConnectionSession session = openSession();
        session.offer(ChatEvent.chat("Bob", "1"));
        session.offer(ChatEvent.chat("Bob", "2"));
        session.offer(ChatEvent.chat("Bob", "3"));
        session.beginClose(CloseStatus.GOING_AWAY);

        session.drain();

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(transport, times(3)).sendMessage(sent.capture());
        List<String> payloads = sent.getAllValues().stream().map(TextMessage::getPayload).toList();
        assertThat(payloads.get(0)).contains("\"content\":\"1\"");
        assertThat(payloads.get(1)).contains("\"content\":\"2\"");
        assertThat(payloads.get(2)).contains("\"content\":\"3\"");
        verify(transport).close(CloseStatus.GOING_AWAY);
        verify(lifecycle).closed(session);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
    }

    @Test
    void drain_erreurDEcriture_fermeLaConnexion() throws IOException {
        ConnectionSession session = openSession();
        session.offer(ChatEvent.chat("Bob", "1"));
        session.offer(ChatEvent.chat("Bob", "2"));
        doThrow(new IOException("broken pipe")).when(transport).sendMessage(any());
        session.beginClose(CloseStatus.NORMAL);

        session.drain();

        verify(transport, times(1)).sendMessage(any());
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        verify(lifecycle).closed(session);
    }

    @Test
    void sendPrivate_horodateSiAbsent() throws IOException {
        ConnectionSession session = openSession();

        assertThat(session.sendPrivate(ChatEvent.welcome("Alice"))).isTrue();
        session.beginClose(CloseStatus.NORMAL);
        session.drain();

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(transport).sendMessage(sent.capture());
        assertThat(sent.getValue().getPayload())
                .contains("\"username\":\"System\"")
                .contains("Welcome to the chat, Alice!")
                .contains("\"timestamp\":7000")
                .doesNotContain("users");
    }

    @Test
    void start_executeurSature_fermeAussitot() throws IOException {
        ConnectionSession session = openSession();
        Executor rejecting = task -> {
            throw new RejectedExecutionException("full");
        };

        session.start(rejecting);

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        verify(transport).close(CloseStatus.SERVICE_OVERLOAD);
        verify(lifecycle).closed(session);
    }

    // --------------------------------------------------------------
    // Contre-pression
    // --------------------------------------------------------------
    @Test
    void overflow_fermeLeClientLentParDefaut() {
        settings.setOutboundQueueCapacity(2);
        ConnectionSession session = openSession();

        assertThat(session.offer(ChatEvent.chat("Bob", "1"))).isEqualTo(EventSink.Delivery.QUEUED);
        assertThat(session.offer(ChatEvent.chat("Bob", "2"))).isEqualTo(EventSink.Delivery.QUEUED);
        assertThat(session.offer(ChatEvent.chat("Bob", "3"))).isEqualTo(EventSink.Delivery.QUEUE_FULL);
        session.overflow();

        assertThat(session.getDroppedCount()).isEqualTo(1);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSING);
        assertThat(session.getCloseStatus().getCode()).isEqualTo(CloseStatus.SESSION_NOT_RELIABLE.getCode());
        verify(lifecycle).closing(session);
    }

    @Test
    void overflow_sansFermeture_compteSeulementLaPerte() {
        settings.setOutboundQueueCapacity(1);
        settings.setCloseOnOverflow(false);
        ConnectionSession session = openSession();
        session.offer(ChatEvent.chat("Bob", "1"));

        assertThat(session.sendPrivate(ChatEvent.invalidFormat())).isFalse();

        assertThat(session.getDroppedCount()).isEqualTo(1);
        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        verify(lifecycle, never()).closing(any());
    }

    @Test
    void forceClose_coupeMemeAvecDesEventsEnAttente() throws IOException {
        ConnectionSession session = openSession();
        session.offer(ChatEvent.chat("Bob", "stuck"));
        session.beginClose(CloseStatus.GOING_AWAY);

        session.forceClose();

        verify(transport).close(CloseStatus.GOING_AWAY);
        verify(transport, never()).sendMessage(any());
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
    }

    @Test
    void forceClose_libereLaSessionAvantDeFermerLeTransport() throws IOException {
        ConnectionSession session = openSession();
        session.beginClose(CloseStatus.GOING_AWAY);

        session.forceClose();

        InOrder order = inOrder(lifecycle, transport);
        order.verify(lifecycle).closed(session);
        order.verify(transport).close(CloseStatus.GOING_AWAY);
    }

    // --------------------------------------------------------------
    // Pings
    // --------------------------------------------------------------
    @Test
    void requestPing_lEcrivainEnvoieUnPing() throws Exception {
        ConnectionSession session = openSession();
        Thread writer = new Thread(session::drain);
        writer.start();

        session.requestPing();

        verify(transport, timeout(2_000)).sendMessage(any(PingMessage.class));
        session.transportClosed(CloseStatus.NORMAL);
        writer.join(2_000);
        assertThat(writer.isAlive()).isFalse();
    }

    @Test
    void requestPing_ignoreUneFoisEnFermeture() throws IOException {
        ConnectionSession session = openSession();
        session.beginClose(CloseStatus.NORMAL);

        session.requestPing();
        session.drain();

        verify(transport, never()).sendMessage(any());
    }
}
