package org.marinchat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app.chat")
@Data
@Validated
public class ChatProperties {

    @NotBlank
    private String topic = "main-chat";

    @Valid
    private final Ws ws = new Ws();
    @Valid
    private final Transcription transcription = new Transcription();

    @Data
    public static class Ws {
        @NotBlank
        private String path = "/chat";
        @NotNull
        private Duration idleTimeout = Duration.ofMinutes(2);
        @Positive
        private int outboundQueueCapacity = 256;
        @NotNull
        private Duration closeGracePeriod = Duration.ofSeconds(2);
        // file pleine = pair mort : on ferme la connexion au lieu de seulement jeter l'event
        private boolean closeOnOverflow = true;
        @Positive
        private int maxTextMessageBytes = 1024 * 1024;
        // null = moitié de idleTimeout ; un client qui répond aux pings reste ouvert
        private Duration pingInterval;

        public Duration effectivePingInterval() {
            return pingInterval != null ? pingInterval : idleTimeout.dividedBy(2);
        }
    }

    @Data
    public static class Transcription {
        @Positive
        private long maxBytes = 5L * 1024 * 1024;
        @NotEmpty
        private List<String> allowedTypes = new ArrayList<>(
                List.of("audio/webm", "audio/mp4", "audio/wav", "audio/mpeg"));
        @NotNull
        private Duration simulatedDelay = Duration.ZERO;
        // injection de pannes pour les tests, désactivée par défaut
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double failureRate = 0.0;
    }
}
