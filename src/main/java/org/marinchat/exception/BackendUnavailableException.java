package org.marinchat.exception;

import org.springframework.http.HttpStatus;

// backend en panne ou trop lent : pas de retry automatique, c'est à l'appelant de décider
public class BackendUnavailableException extends ApiException {

    public static final String REASON = "backend-unavailable";
    public static final String PUBLIC_MESSAGE = "Service temporarily unavailable";

    public BackendUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, REASON, message, cause);
    }

    public BackendUnavailableException(String message) {
        this(message, null);
    }
}
