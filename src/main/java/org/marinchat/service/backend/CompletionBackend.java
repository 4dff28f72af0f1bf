package org.marinchat.service.backend;

import org.marinchat.dto.ChatMessage;

import java.util.List;

@FunctionalInterface
public interface CompletionBackend {

    /**
     * @return le texte de la réponse de l'assistant
     * @throws BackendException si le service d'inférence échoue
     */
    String complete(List<ChatMessage> messages, String model, boolean webSearch);
}
