package org.marinchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {
    @NotBlank(message = "Message text is required")
    private String text;
    private String role; // "user" | "assistant"
}
