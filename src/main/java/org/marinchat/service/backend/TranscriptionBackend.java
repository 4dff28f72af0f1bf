package org.marinchat.service.backend;

import org.marinchat.dto.AudioPayload;

@FunctionalInterface
public interface TranscriptionBackend {

    /**
     * @return le texte transcrit
     * @throws BackendException si le service de transcription échoue
     */
    String transcribe(AudioPayload audio);
}
