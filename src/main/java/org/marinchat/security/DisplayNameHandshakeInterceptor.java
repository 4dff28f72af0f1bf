package org.marinchat.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Lit le pseudo au moment de l'upgrade. Pas d'authentification : le pseudo
 * fourni par le client est pris tel quel.
 */
@Component
public class DisplayNameHandshakeInterceptor implements HandshakeInterceptor {

    public static final String DISPLAY_NAME = "displayName";
    public static final String USERNAME_PARAM = "username";
    public static final String USERNAME_HEADER = "X-Username";
    static final int MAX_LENGTH = 50;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String name = null;
        if (request instanceof ServletServerHttpRequest http) {
            HttpServletRequest req = http.getServletRequest();
            // 1) query param, 2) header
            name = req.getParameter(USERNAME_PARAM);
            if (name == null || name.isBlank()) {
                name = req.getHeader(USERNAME_HEADER);
            }
        } else {
            name = request.getHeaders().getFirst(USERNAME_HEADER);
        }
        attributes.put(DISPLAY_NAME, normalize(name));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               @Nullable Exception ex) {
    }

    static String normalize(String raw) {
        if (raw == null || raw.isBlank()) return generatedName();
        String trimmed = raw.trim();
        return trimmed.length() > MAX_LENGTH ? trimmed.substring(0, MAX_LENGTH) : trimmed;
    }

    public static String generatedName() {
        return "User" + ThreadLocalRandom.current().nextInt(1000);
    }
}
