package org.marinchat.service;

import lombok.extern.slf4j.Slf4j;
import org.marinchat.dto.ChatCompletionRequest;
import org.marinchat.dto.ChatCompletionResponse;
import org.marinchat.dto.ChatMessage;
import org.marinchat.exception.BackendUnavailableException;
import org.marinchat.exception.ValidationException;
import org.marinchat.service.backend.BackendInvoker;
import org.marinchat.service.backend.CompletionBackend;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ChatCompletionService {

    private final CompletionBackend backend;
    private final BackendInvoker invoker;

    public ChatCompletionService(CompletionBackend backend, BackendInvoker invoker) {
        this.backend = backend;
        this.invoker = invoker;
    }

    public ChatCompletionResponse complete(ChatCompletionRequest request) {
        List<ChatMessage> messages = (request != null) ? request.getMessages() : null;
        if (messages == null || messages.isEmpty()) {
            throw ValidationException.invalidRequest("Messages array is required");
        }
        for (ChatMessage m : messages) {
            if (m == null || m.getText() == null || m.getText().isBlank()) {
                throw ValidationException.invalidRequest("Message text is required");
            }
        }

        String model = request.modelOrDefault();
        boolean webSearch = request.webSearchEnabled();
        log.debug("completion request: {} message(s), model={}, webSearch={}", messages.size(), model, webSearch);

        String content = invoker.call("completion", () -> backend.complete(List.copyOf(messages), model, webSearch));
        if (content == null || content.isBlank()) {
            log.warn("completion backend returned an empty reply");
            throw new BackendUnavailableException("completion backend returned no content");
        }
        return ChatCompletionResponse.assistant(content);
    }
}
