package org.marinchat.service;

import lombok.extern.slf4j.Slf4j;
import org.marinchat.config.ChatProperties;
import org.marinchat.dto.AudioPayload;
import org.marinchat.dto.TranscribeResponse;
import org.marinchat.exception.ValidationException;
import org.marinchat.service.backend.BackendInvoker;
import org.marinchat.service.backend.TranscriptionBackend;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Validation de l'audio puis appel du backend de transcription. Rien n'est
 * envoyé au backend tant que la taille et le format ne sont pas acceptés.
 */
@Slf4j
@Service
public class TranscriptionService {

    private final TranscriptionBackend backend;
    private final BackendInvoker invoker;
    private final ChatProperties props;

    public TranscriptionService(TranscriptionBackend backend, BackendInvoker invoker, ChatProperties props) {
        this.backend = backend;
        this.invoker = invoker;
        this.props = props;
    }

    public TranscribeResponse transcribe(AudioPayload audio, String messageId) {
        validate(audio);
        log.debug("transcribing {} bytes of {} ({})", audio.size(), normalizeType(audio.contentType()), audio.filename());
        String text = invoker.call("transcription", () -> backend.transcribe(audio));
        return TranscribeResponse.ok(text, messageId);
    }

    void validate(AudioPayload audio) {
        if (audio == null || audio.size() == 0) {
            throw new ValidationException(ValidationException.NO_AUDIO, "No audio file provided");
        }
        ChatProperties.Transcription cfg = props.getTranscription();
        if (audio.size() > cfg.getMaxBytes()) {
            throw tooLarge();
        }
        if (!isAllowed(audio.contentType())) {
            throw new ValidationException(ValidationException.UNSUPPORTED_FORMAT,
                    "Unsupported audio format. Allowed: " + String.join(", ", cfg.getAllowedTypes()));
        }
    }

    public ValidationException tooLarge() {
        long mib = props.getTranscription().getMaxBytes() / (1024 * 1024);
        return new ValidationException(ValidationException.TOO_LARGE, "File size exceeds " + mib + "MB limit");
    }

    public long maxBytes() {
        return props.getTranscription().getMaxBytes();
    }

    private boolean isAllowed(String contentType) {
        String type = normalizeType(contentType);
        if (type == null) return false;
        List<String> allowed = props.getTranscription().getAllowedTypes();
        return allowed.stream().anyMatch(a -> a.equalsIgnoreCase(type));
    }

    // "audio/webm;codecs=opus" -> "audio/webm"
    static String normalizeType(String contentType) {
        if (contentType == null) return null;
        int semi = contentType.indexOf(';');
        String base = (semi >= 0 ? contentType.substring(0, semi) : contentType).trim();
        return base.isEmpty() ? null : base.toLowerCase(Locale.ROOT);
    }
}
