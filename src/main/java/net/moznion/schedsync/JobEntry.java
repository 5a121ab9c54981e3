package net.moznion.schedsync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A fully resolved scheduler entry, upserted into the scheduler store keyed by {@code id}.
 * {@code config} and {@code dependsOn} are JSON text because the store keeps them as opaque
 * text columns.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({ "id", "name", "type", "schedule", "timezone", "environment", "status", "config",
                     "depends_on" })
public class JobEntry {
    @JsonProperty("id")
    String id;

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

    @JsonProperty("config")
    String config;

    @JsonProperty("depends_on")
    String dependsOn;
}
