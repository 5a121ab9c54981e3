package net.moznion.schedsync;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-user overrides. Addressed by an external user id; {@code userId} is only an optional echo
 * of it found in stored profiles.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserProfile {
    public static final UserProfile EMPTY = UserProfile.builder().build();

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("schedule_overrides")
    Map<String, String> scheduleOverrides;

    @JsonProperty("timezone")
    String timezone;

    // null means every multi-user job is enabled
    @JsonProperty("enabled_jobs")
    List<String> enabledJobs;

    public Optional<String> scheduleOverrideFor(final String jobName) {
        if (scheduleOverrides == null || !scheduleOverrides.containsKey(jobName)) {
            return Optional.empty();
        }
        return Optional.ofNullable(scheduleOverrides.get(jobName));
    }

    public boolean enables(final String jobName) {
        return enabledJobs == null || enabledJobs.contains(jobName);
    }
}
