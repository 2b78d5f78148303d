package com.cardrewards.ingest.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request payload for the Ollama-compatible chat endpoint.
 */
public record ChatRequest(

    @JsonProperty("model")
    String model,

    @JsonProperty("messages")
    List<Message> messages,

    @JsonProperty("stream")
    boolean stream
) {

    public static ChatRequest singleTurn(String model, String content) {
        return new ChatRequest(model, List.of(new Message("user", content)), false);
    }

    public record Message(

        @JsonProperty("role")
        String role,

        @JsonProperty("content")
        String content
    ) {}
}
