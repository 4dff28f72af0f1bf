package org.marinchat.service.backend;

import org.marinchat.dto.ChatMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Réponses toutes faites en attendant un vrai fournisseur d'IA.
 */
@Component
public class CannedCompletionBackend implements CompletionBackend {

    static final List<String> RESPONSES = List.of(
            "That's a really interesting point! Let me think about that for a moment...",
            "I understand what you're asking. Here's my perspective on that:",
            "Great question! Based on what you've shared, I think...",
            "That reminds me of something important we should consider:",
            "Let me help you with that! Here's what I would suggest:"
    );

    static final String WEATHER = "Looking at the weather today, I'd recommend something cozy yet stylish! "
            + "Maybe a cute jacket with some trendy boots?";
    static final String SPECIAL = "Ooh, a special occasion! How exciting! "
            + "Let's pick something that makes you feel absolutely gorgeous~";
    static final String CASUAL = "Casual style is my favorite! "
            + "Let's create a comfortable yet super cute everyday look!";

    @Override
    public String complete(List<ChatMessage> messages, String model, boolean webSearch) {
        String last = lastText(messages).toLowerCase(Locale.ROOT);

        if (last.contains("weather") || last.contains("rain")) return WEATHER;
        if (last.contains("date") || last.contains("special")) return SPECIAL;
        if (last.contains("casual") || last.contains("everyday")) return CASUAL;

        return RESPONSES.get(ThreadLocalRandom.current().nextInt(RESPONSES.size()));
    }

    private String lastText(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) return "";
        String text = messages.get(messages.size() - 1).getText();
        return text != null ? text : "";
    }
}
