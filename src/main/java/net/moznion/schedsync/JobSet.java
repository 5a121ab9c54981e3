package net.moznion.schedsync;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import net.moznion.schedsync.expansion.MultiUserJobNames;

import lombok.Value;

/**
 * Job definitions together with the users they fan out to. Users are ordered by user id.
 */
@Value
public class JobSet {
    List<JobDefinition> jobs;
    SortedMap<String, UserProfile> users;

    public JobSet(final List<JobDefinition> jobs, final Map<String, UserProfile> users) {
        this.jobs = Collections.unmodifiableList(jobs);
        this.users = Collections.unmodifiableSortedMap(new TreeMap<>(users));
    }

    public Set<String> multiUserJobNames() {
        return MultiUserJobNames.of(jobs);
    }
}
