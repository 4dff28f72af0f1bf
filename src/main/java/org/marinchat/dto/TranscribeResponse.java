package org.marinchat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranscribeResponse {
    String transcription;
    boolean success;
    String error;
    String reason;    // code machine : too-large, unsupported-format, ...
    String messageId; // renvoyé tel quel si fourni

    public static TranscribeResponse ok(String transcription, String messageId) {
        return TranscribeResponse.builder().success(true)
                .transcription(transcription).messageId(messageId).build();
    }

    public static TranscribeResponse failure(String error, String reason, String messageId) {
        return TranscribeResponse.builder().success(false)
                .error(error).reason(reason).messageId(messageId).build();
    }
}
