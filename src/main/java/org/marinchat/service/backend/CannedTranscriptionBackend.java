package org.marinchat.service.backend;

import org.marinchat.config.ChatProperties;
import org.marinchat.dto.AudioPayload;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Transcriptions factices. Le délai simulé et le taux de panne viennent de
 * la configuration ({@code app.chat.transcription.*}), à zéro par défaut.
 */
@Component
public class CannedTranscriptionBackend implements TranscriptionBackend {

    static final List<String> TRANSCRIPTIONS = List.of(
            "Hello, this is a test transcription of the audio file.",
            "Can you hear me clearly? I'm testing the audio transcription feature.",
            "This is another example of what a transcribed audio message might look like.",
            "The weather is really nice today, don't you think?",
            "I'm excited to try out this new chat application with voice features."
    );

    private final ChatProperties props;

    public CannedTranscriptionBackend(ChatProperties props) {
        this.props = props;
    }

    @Override
    public String transcribe(AudioPayload audio) {
        ChatProperties.Transcription cfg = props.getTranscription();
        simulateDelay(cfg.getSimulatedDelay());

        double failureRate = cfg.getFailureRate();
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw new BackendException("Simulated transcription failure");
        }
        return TRANSCRIPTIONS.get(ThreadLocalRandom.current().nextInt(TRANSCRIPTIONS.size()));
    }

    private void simulateDelay(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Transcription interrupted", e);
        }
    }
}
