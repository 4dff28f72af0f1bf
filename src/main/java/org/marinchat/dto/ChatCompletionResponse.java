package org.marinchat.dto;

import lombok.Value;

@Value
public class ChatCompletionResponse {
    String role;
    String content;

    public static ChatCompletionResponse assistant(String content) {
        return new ChatCompletionResponse("assistant", content);
    }
}
