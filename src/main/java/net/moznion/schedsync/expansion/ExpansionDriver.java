package net.moznion.schedsync.expansion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.moznion.schedsync.JobDefinition;
import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.JobSet;
import net.moznion.schedsync.UserProfile;
import net.moznion.schedsync.store.JobEntryStore;
import net.moznion.schedsync.sync.SyncOrchestrator;
import net.moznion.schedsync.sync.SyncResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Fans job definitions out over the user set.
 * <p>
 * A job named in the multi-user set gets one entry per user who enables it, users taken in user id
 * order; every other job gets exactly one entry. Entries come back in job order whether or not
 * expansion runs in parallel.
 */
@Slf4j
public class ExpansionDriver {
    private final JobEntryBuilder builder;
    private final boolean parallel;

    public ExpansionDriver() {
        this(new JobEntryBuilder(), false);
    }

    public ExpansionDriver(final JobEntryBuilder builder, final boolean parallel) {
        this.builder = builder;
        this.parallel = parallel;
    }

    public List<JobEntry> expand(final JobSet jobSet) {
        return expand(jobSet.getJobs(), jobSet.getUsers(), jobSet.multiUserJobNames());
    }

    public List<JobEntry> expand(final List<JobDefinition> jobs,
                                 final Map<String, UserProfile> users,
                                 final Set<String> multiUserJobNames) {
        final SortedMap<String, UserProfile> orderedUsers = new TreeMap<>(users);
        final Set<String> perUserNames = Collections.unmodifiableSet(new LinkedHashSet<>(multiUserJobNames));

        final Stream<JobDefinition> stream = parallel ? jobs.parallelStream() : jobs.stream();
        final List<JobEntry> entries = stream.flatMap(job -> expandJob(job, orderedUsers, perUserNames).stream())
                                             .collect(Collectors.toList());

        log.debug("Expanded job definitions [jobs={}, users={}, entries={}, parallel={}]",
                  jobs.size(), orderedUsers.size(), entries.size(), parallel);
        return entries;
    }

    public <T extends JobEntryStore> SyncResult expandAndSync(final JobSet jobSet,
                                                              final SyncOrchestrator<T> orchestrator,
                                                              final boolean prune) throws InterruptedException {
        return orchestrator.sync(expand(jobSet), prune);
    }

    private List<JobEntry> expandJob(final JobDefinition job,
                                     final SortedMap<String, UserProfile> users,
                                     final Set<String> multiUserJobNames) {
        if (!multiUserJobNames.contains(job.getName())) {
            return Collections.singletonList(builder.build(job));
        }

        final List<JobEntry> entries = new ArrayList<>(users.size());
        for (final Entry<String, UserProfile> entry : users.entrySet()) {
            final String userId = entry.getKey();
            final UserProfile user = entry.getValue() == null ? UserProfile.EMPTY : entry.getValue();
            if (!user.enables(job.getName())) {
                log.debug("Job is not enabled for user [job={}, userId={}]", job.getName(), userId);
                continue;
            }
            entries.add(builder.build(job, new ExpansionContext(userId, user, multiUserJobNames)));
        }

        if (entries.isEmpty()) {
            log.warn("Multi-user job has no enabled users [job={}]", job.getName());
        }
        return entries;
    }
}
