package net.moznion.schedsync;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named job template, independent of any particular user.
 * <p>
 * Every member except {@code name} and {@code type} may be absent ({@code null}). For
 * {@code after}, {@code null} (no dependency list at all) and an empty list are different
 * things and are kept apart.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobDefinition {
    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    String type;

    @JsonProperty("schedule")
    String schedule;

    @JsonProperty("timezone")
    String timezone;

    @JsonProperty("environment")
    String environment;

    @JsonProperty("status")
    String status;

    @JsonProperty("script")
    ScriptSpec script;

    @JsonProperty("agent")
    JsonNode agent;

    @JsonProperty("after")
    List<String> after;

    @JsonProperty("multi_user")
    Boolean multiUser;

    @JsonIgnore
    public boolean isPerUser() {
        return Boolean.TRUE.equals(multiUser);
    }

    @JsonIgnore
    public Optional<JobType> getKnownType() {
        return JobType.fromValue(type);
    }
}
