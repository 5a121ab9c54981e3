package net.moznion.schedsync.expansion;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

import net.moznion.schedsync.EntryDefaults;
import net.moznion.schedsync.JobDefinition;
import net.moznion.schedsync.JobEntry;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Resolves a job definition into a scheduler entry.
 * <p>
 * Never rejects a definition: every member the definition leaves out falls back to a default or
 * to {@code null}. Building is pure, so the same arguments always give an equal entry.
 */
public class JobEntryBuilder {
    private final EntryDefaults defaults;
    private final JobConfigBuilder configBuilder;
    private final DependencySerializer dependencySerializer;

    public JobEntryBuilder() {
        this(EntryDefaults.STANDARD);
    }

    public JobEntryBuilder(final EntryDefaults defaults) {
        this(defaults, new ObjectMapper());
    }

    public JobEntryBuilder(final EntryDefaults defaults, final ObjectMapper mapper) {
        this.defaults = defaults;
        configBuilder = new JobConfigBuilder(mapper);
        dependencySerializer = new DependencySerializer(mapper);
    }

    /**
     * Builds the one entry of a single-instance job; its id is the job name.
     */
    public JobEntry build(final JobDefinition job) {
        return build(job, Optional.empty());
    }

    /**
     * Builds the instance of a multi-user job that belongs to {@code context.getUserId()}; its id
     * is {@code <name>--<userId>}.
     */
    public JobEntry build(final JobDefinition job, final ExpansionContext context) {
        return build(job, Optional.of(context));
    }

    private JobEntry build(final JobDefinition job, final Optional<ExpansionContext> maybeContext) {
        final String userId = maybeContext.map(ExpansionContext::getUserId).orElse(null);
        final Set<String> multiUserJobNames = maybeContext.map(ExpansionContext::getMultiUserJobNames)
                                                          .orElse(Collections.emptySet());

        return JobEntry.builder()
                       .id(resolveId(job, maybeContext))
                       .name(job.getName())
                       .type(job.getType())
                       .schedule(resolveSchedule(job, maybeContext))
                       .timezone(resolveTimezone(job, maybeContext))
                       .environment(Optional.ofNullable(job.getEnvironment()).orElse(defaults.getEnvironment()))
                       .status(Optional.ofNullable(job.getStatus()).orElse(defaults.getStatus()))
                       .config(configBuilder.serialize(configBuilder.build(job, userId)))
                       .dependsOn(dependencySerializer.serialize(job.getAfter(), userId, multiUserJobNames))
                       .build();
    }

    private static String resolveId(final JobDefinition job, final Optional<ExpansionContext> maybeContext) {
        if (!maybeContext.isPresent()) {
            return job.getName();
        }
        return EntryDefaults.perUserId(job.getName(), maybeContext.get().getUserId());
    }

    private static String resolveSchedule(final JobDefinition job,
                                          final Optional<ExpansionContext> maybeContext) {
        return maybeContext.flatMap(c -> c.getUser().scheduleOverrideFor(job.getName()))
                           .orElse(job.getSchedule());
    }

    // a user context always wins, even when the user has no timezone
    private static String resolveTimezone(final JobDefinition job,
                                          final Optional<ExpansionContext> maybeContext) {
        if (maybeContext.isPresent()) {
            return maybeContext.get().getUser().getTimezone();
        }
        return job.getTimezone();
    }
}
