package org.marinchat.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionRequest {

    public static final String DEFAULT_MODEL = "gpt-4o";

    @NotEmpty(message = "Messages array is required")
    private List<@Valid ChatMessage> messages;
    private String model;
    private Boolean webSearch;

    public String modelOrDefault() {
        return (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
    }

    public boolean webSearchEnabled() {
        return Boolean.TRUE.equals(webSearch);
    }
}
