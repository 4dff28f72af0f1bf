package org.marinchat.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.security.DisplayNameHandshakeInterceptor;
import org.marinchat.service.ws.ChatSessionService;
import org.marinchat.service.ws.ConnectionSession;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;

/**
 * Point d'entrée WebSocket ({@code /chat}) : traduit les callbacks du
 * conteneur en appels sur la session de chat.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final ChatSessionService sessions;

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        Object name = ws.getAttributes().get(DisplayNameHandshakeInterceptor.DISPLAY_NAME);
        String displayName = (name instanceof String s && !s.isBlank())
                ? s
                : DisplayNameHandshakeInterceptor.generatedName();
        sessions.open(ws, displayName);
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        ConnectionSession session = sessionOf(ws);
        if (session != null) sessions.handleFrame(session, message.getPayload());
    }

    // certains clients envoient le JSON en binaire
    @Override
    protected void handleBinaryMessage(WebSocketSession ws, BinaryMessage message) {
        ConnectionSession session = sessionOf(ws);
        if (session == null) return;
        byte[] bytes = new byte[message.getPayloadLength()];
        message.getPayload().duplicate().get(bytes);
        sessions.handleFrame(session, new String(bytes, StandardCharsets.UTF_8));
    }

    @Override
    protected void handlePongMessage(WebSocketSession ws, PongMessage message) {
        ConnectionSession session = sessionOf(ws);
        if (session != null) sessions.touch(session);
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        ConnectionSession session = sessionOf(ws);
        if (session != null) sessions.transportFailed(session, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        ConnectionSession session = sessionOf(ws);
        if (session != null) sessions.transportClosed(session, status);
    }

    private ConnectionSession sessionOf(WebSocketSession ws) {
        Object s = ws.getAttributes().get(ChatSessionService.SESSION_ATTRIBUTE);
        if (s instanceof ConnectionSession cs) return cs;
        log.debug("no chat session bound to {}", ws.getId());
        return null;
    }
}
