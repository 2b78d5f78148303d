package com.cardrewards.ingest.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response payload from the Ollama-compatible chat endpoint.
 * Only the assistant message is read; timing and token fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatResponse(

    @JsonProperty("model")
    String model,

    @JsonProperty("message")
    ChatRequest.Message message,

    @JsonProperty("done")
    Boolean done
) {

    public String content() {
        return message != null ? message.content() : null;
    }
}
