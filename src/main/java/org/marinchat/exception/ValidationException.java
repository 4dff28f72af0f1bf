package org.marinchat.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {

    public static final String INVALID_REQUEST = "invalid-request";
    public static final String NO_AUDIO = "no-audio";
    public static final String TOO_LARGE = "too-large";
    public static final String UNSUPPORTED_FORMAT = "unsupported-format";

    public ValidationException(String reason, String message) {
        super(HttpStatus.BAD_REQUEST, reason, message, null);
    }

    public static ValidationException invalidRequest(String message) {
        return new ValidationException(INVALID_REQUEST, message);
    }
}
