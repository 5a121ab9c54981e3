package net.moznion.schedsync.expansion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import net.moznion.schedsync.EntryDefaults;
import net.moznion.schedsync.exception.JobSerializationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes a job's upstream dependency list as JSON text, pointing references to multi-user jobs at
 * the instance that belongs to the same user.
 */
public class DependencySerializer {
    private final ObjectMapper mapper;

    public DependencySerializer() {
        this(new ObjectMapper());
    }

    public DependencySerializer(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param deps upstream job names in order, or {@code null} when the job has no dependency list
     * @param userId user of the instance being built, or {@code null} for a single-instance job
     * @param multiUserJobNames names of jobs that are instantiated once per user
     * @return {@code null} for {@code null} deps, otherwise a JSON array in the order of {@code deps}
     */
    public String serialize(final List<String> deps,
                            final String userId,
                            final Set<String> multiUserJobNames) {
        if (deps == null) {
            return null;
        }

        final Set<String> perUserNames = multiUserJobNames == null ? Collections.emptySet() : multiUserJobNames;
        final List<String> rewritten = new ArrayList<>(deps.size());
        for (final String dep : deps) {
            rewritten.add(rewrite(dep, userId, perUserNames));
        }

        try {
            return mapper.writeValueAsString(rewritten);
        } catch (JsonProcessingException e) {
            throw new JobSerializationException("Failed to serialize dependencies " + deps, e);
        }
    }

    static String rewrite(final String dep, final String userId, final Set<String> multiUserJobNames) {
        if (userId == null || dep == null || !multiUserJobNames.contains(dep)) {
            return dep;
        }
        return EntryDefaults.perUserId(dep, userId);
    }
}
