package org.marinchat.config;

import org.marinchat.controller.ChatWebSocketHandler;
import org.marinchat.security.DisplayNameHandshakeInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatHandler;
    private final DisplayNameHandshakeInterceptor displayNameInterceptor;
    private final ChatProperties props;

    public WsConfig(ChatWebSocketHandler chatHandler,
                    DisplayNameHandshakeInterceptor displayNameInterceptor,
                    ChatProperties props) {
        this.chatHandler = chatHandler;
        this.displayNameInterceptor = displayNameInterceptor;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // politique CORS permissive, comme pour le HTTP
        registry.addHandler(chatHandler, props.getWs().getPath())
                .addInterceptors(displayNameInterceptor)
                .setAllowedOriginPatterns("*");
    }

    /**
     * Tampons du conteneur : fixés avant tout handshake, sinon Tomcat garde
     * ses 8 Kio par défaut et ferme en 1009 les trames plus grandes.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(props.getWs().getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(props.getWs().getMaxTextMessageBytes());
        return container;
    }
}
