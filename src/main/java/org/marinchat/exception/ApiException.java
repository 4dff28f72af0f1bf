package org.marinchat.exception;

import org.springframework.http.HttpStatus;

/**
 * Erreur renvoyée à l'appelant d'un endpoint REST, avec son statut HTTP et
 * un code machine ({@code too-large}, {@code backend-unavailable}...).
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String reason;

    protected ApiException(HttpStatus status, String reason, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.reason = reason;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
