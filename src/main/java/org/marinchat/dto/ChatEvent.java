package org.marinchat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Trame sortante serveur → client. Immuable : la même instance est partagée
 * par toutes les files sortantes lors d'un broadcast.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {

    public static final String SYSTEM_USER = "System";

    public enum Type {
        JOIN("join"),
        LEAVE("leave"),
        CHAT("chat"),
        USER_LIST("user_list");

        private final String wire;

        Type(String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() {
            return wire;
        }
    }

    Type type;
    String content;
    String username;
    @With
    Long timestamp;
    List<String> users; // seulement pour USER_LIST

    public static ChatEvent chat(String username, String content) {
        return ChatEvent.builder().type(Type.CHAT).username(username).content(content).build();
    }

    public static ChatEvent join(String username) {
        return ChatEvent.builder().type(Type.JOIN).username(username)
                .content(username + " joined the chat").build();
    }

    public static ChatEvent leave(String username) {
        return ChatEvent.builder().type(Type.LEAVE).username(username)
                .content(username + " left the chat").build();
    }

    public static ChatEvent welcome(String username) {
        return system("Welcome to the chat, " + username + "!");
    }

    public static ChatEvent invalidFormat() {
        return system("Error: Invalid message format");
    }

    public static ChatEvent system(String content) {
        return chat(SYSTEM_USER, content);
    }

    public static ChatEvent userList(List<String> users) {
        return ChatEvent.builder().type(Type.USER_LIST).users(List.copyOf(users)).build();
    }
}
