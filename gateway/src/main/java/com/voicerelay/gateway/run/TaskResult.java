package com.voicerelay.gateway.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Final text of one run, published as {@code {"type":"result","taskId":…,"text":…}}.
 */
@JsonPropertyOrder({"type", "taskId", "text"})
public record TaskResult(String taskId, String text) {

    @JsonProperty("type")
    public String type() {
        return "result";
    }
}
