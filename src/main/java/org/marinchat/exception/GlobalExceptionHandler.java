package org.marinchat.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.dto.TranscribeResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * Erreurs levées avant ou autour des contrôleurs : JSON illisible, validation,
 * upload trop gros. Les réponses de /api/transcribe gardent la forme
 * {@code {success:false, error, reason}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String TRANSCRIBE_PATH = "/api/transcribe";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<?> handleApi(ApiException e, HttpServletRequest request) {
        String message = (e instanceof BackendUnavailableException)
                ? BackendUnavailableException.PUBLIC_MESSAGE : e.getMessage();
        return respond(request, e.getStatus(), message, e.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse("Invalid request");
        return respond(request, HttpStatus.BAD_REQUEST, message, ValidationException.INVALID_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.debug("unreadable body on {}: {}", request.getRequestURI(), e.getMessage());
        return respond(request, HttpStatus.BAD_REQUEST, "Invalid JSON body", ValidationException.INVALID_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<?> handleMediaType(HttpMediaTypeNotSupportedException e, HttpServletRequest request) {
        return respond(request, HttpStatus.UNSUPPORTED_MEDIA_TYPE, e.getMessage(), "unsupported-media-type");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<?> handleUploadSize(MaxUploadSizeExceededException e, HttpServletRequest request) {
        log.warn("upload rejected on {}: {}", request.getRequestURI(), e.getMessage());
        return respond(request, HttpStatus.BAD_REQUEST, "File size exceeds limit", ValidationException.TOO_LARGE);
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<?> handleMultipart(MultipartException e, HttpServletRequest request) {
        log.warn("bad multipart request on {}: {}", request.getRequestURI(), e.getMessage());
        return respond(request, HttpStatus.BAD_REQUEST, "No audio file provided", ValidationException.NO_AUDIO);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<?> handleNotFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleUnexpected(Exception e, HttpServletRequest request) {
        if (e instanceof ErrorResponse er) {
            // 405, 406... : erreurs du framework qui portent déjà leur statut
            HttpStatus status = HttpStatus.valueOf(er.getStatusCode().value());
            return respond(request, status, status.getReasonPhrase(), "invalid-request");
        }
        log.error("unexpected error on {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "internal");
    }

    private ResponseEntity<?> respond(HttpServletRequest request, HttpStatus status, String message, String reason) {
        if (request.getRequestURI() != null && request.getRequestURI().startsWith(TRANSCRIBE_PATH)) {
            return ResponseEntity.status(status).body(TranscribeResponse.failure(message, reason, null));
        }
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
