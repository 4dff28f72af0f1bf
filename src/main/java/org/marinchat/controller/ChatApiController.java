package org.marinchat.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.marinchat.dto.AudioPayload;
import org.marinchat.dto.ChatCompletionRequest;
import org.marinchat.dto.TranscribeResponse;
import org.marinchat.exception.ApiException;
import org.marinchat.exception.BackendUnavailableException;
import org.marinchat.service.ChatCompletionService;
import org.marinchat.service.TranscriptionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class ChatApiController {

    static final String INTERNAL_ERROR = "Internal server error";
    static final String INTERNAL_REASON = "internal";

    private final ChatCompletionService completionService;
    private final TranscriptionService transcriptionService;

    public ChatApiController(ChatCompletionService completionService, TranscriptionService transcriptionService) {
        this.completionService = completionService;
        this.transcriptionService = transcriptionService;
    }

    // ---------- Complétion ----------

    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> chat(@Valid @RequestBody ChatCompletionRequest request) {
        try {
            return ResponseEntity.ok(completionService.complete(request));
        } catch (ApiException e) {
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", publicMessage(e)));
        }
    }

    // ---------- Transcription ----------

    @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TranscribeResponse> transcribeMultipart(
            @RequestParam(value = "audio", required = false) MultipartFile audio,
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "messageId", required = false) String messageId) {

        MultipartFile part = (audio != null && !audio.isEmpty()) ? audio : file;
        try {
            AudioPayload payload = (part == null)
                    ? new AudioPayload(null, null, null)
                    : readPart(part);
            return ResponseEntity.ok(transcriptionService.transcribe(payload, messageId));
        } catch (ApiException e) {
            return failure(e, messageId);
        } catch (IOException | RuntimeException e) {
            return internal(e, messageId);
        }
    }

    /** Corps brut : {@code Content-Type: audio/...}, le fichier tel quel. */
    @PostMapping("/transcribe")
    public ResponseEntity<TranscribeResponse> transcribeRaw(
            @RequestParam(value = "messageId", required = false) String messageId,
            HttpServletRequest request) {
        try {
            long max = transcriptionService.maxBytes();
            if (request.getContentLengthLong() > max) {
                throw transcriptionService.tooLarge();
            }
            byte[] data;
            try (InputStream in = request.getInputStream()) {
                data = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, max + 1));
            }
            if (data.length > max) {
                throw transcriptionService.tooLarge();
            }
            AudioPayload payload = new AudioPayload(data, request.getContentType(), null);
            return ResponseEntity.ok(transcriptionService.transcribe(payload, messageId));
        } catch (ApiException e) {
            return failure(e, messageId);
        } catch (IOException | RuntimeException e) {
            return internal(e, messageId);
        }
    }

    private AudioPayload readPart(MultipartFile part) throws IOException {
        if (part.getSize() > transcriptionService.maxBytes()) {
            throw transcriptionService.tooLarge();
        }
        return new AudioPayload(part.getBytes(), part.getContentType(), part.getOriginalFilename());
    }

    private ResponseEntity<TranscribeResponse> failure(ApiException e, String messageId) {
        log.warn("transcription rejected ({}): {}", e.getReason(), e.getMessage());
        return ResponseEntity.status(e.getStatus())
                .body(TranscribeResponse.failure(publicMessage(e), e.getReason(), messageId));
    }

    private ResponseEntity<TranscribeResponse> internal(Exception e, String messageId) {
        log.error("transcription failed", e);
        return ResponseEntity.internalServerError()
                .body(TranscribeResponse.failure(INTERNAL_ERROR, INTERNAL_REASON, messageId));
    }

    // le détail d'une panne backend reste dans les logs
    static String publicMessage(ApiException e) {
        return (e instanceof BackendUnavailableException)
                ? BackendUnavailableException.PUBLIC_MESSAGE
                : e.getMessage();
    }
}
