package org.marinchat.service.backend;

/**
 * Échec signalé par un backend d'inférence / transcription.
 */
public class BackendException extends RuntimeException {
    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
