package net.moznion.schedsync.expansion;

import net.moznion.schedsync.JobConfig;
import net.moznion.schedsync.JobDefinition;
import net.moznion.schedsync.OptionalField;
import net.moznion.schedsync.ScriptSpec;
import net.moznion.schedsync.exception.JobSerializationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JobConfigBuilder {
    static final String USER_FLAG_PREFIX = " --user=";

    private final ObjectMapper mapper;

    public JobConfigBuilder() {
        this(new ObjectMapper());
    }

    public JobConfigBuilder(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JobConfig build(final JobDefinition job) {
        return build(job, null);
    }

    /**
     * Builds the runtime payload of a job. With a user id the script command gets a
     * {@code --user=} flag and the payload carries {@code user_id}; without one the script is
     * handed over unchanged and {@code user_id} is left out.
     */
    public JobConfig build(final JobDefinition job, final String userId) {
        final ScriptSpec script = job.getScript();
        final ScriptSpec resolvedScript;
        if (script == null) {
            resolvedScript = null;
        } else if (userId == null) {
            resolvedScript = script;
        } else {
            resolvedScript = script.withCommand(appendUserFlag(script.getCommand(), userId));
        }

        // an explicit "agent": null counts as no agent
        final JsonNode agent = job.getAgent();
        return new JobConfig(resolvedScript, agent == null || agent.isNull() ? null : agent.deepCopy(), userId);
    }

    public String serialize(final JobConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new JobSerializationException("Failed to serialize job config " + config, e);
        }
    }

    /**
     * Appends {@code " --user=<userId>"} to a command. A missing command stays missing and an
     * explicit null stays null.
     */
    public static OptionalField<String> appendUserFlag(final OptionalField<String> command, final String userId) {
        return command.map(c -> c + USER_FLAG_PREFIX + userId);
    }
}
