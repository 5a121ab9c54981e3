package net.moznion.schedsync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Value;

/**
 * Runtime payload of a scheduler entry.
 * <p>
 * {@code script} is always written, as {@code null} when the job has none. {@code agent} and
 * {@code user_id} are left out entirely when absent; consumers detect a per-user instance by
 * the presence of {@code user_id}.
 */
@Value
@JsonPropertyOrder({ "script", "agent", "user_id" })
public class JobConfig {
    @JsonProperty("script")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    ScriptSpec script;

    @JsonProperty("agent")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    JsonNode agent;

    @JsonProperty("user_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String userId;
}
