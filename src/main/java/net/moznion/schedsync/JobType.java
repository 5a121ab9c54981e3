package net.moznion.schedsync;

import java.util.Optional;

/**
 * Job kinds the scheduler knows how to run. A job definition may carry any other type string;
 * it is passed through as is.
 */
public enum JobType {
    SCRIPT("script"),
    AGENT_RUN("agent-run");

    private final String value;

    JobType(final String value) {
        this.value = value;
    }

    public static Optional<JobType> fromValue(final String value) {
        for (final JobType jobType : values()) {
            if (jobType.value.equals(value)) {
                return Optional.of(jobType);
            }
        }
        return Optional.empty();
    }
}
