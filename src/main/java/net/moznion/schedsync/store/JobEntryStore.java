package net.moznion.schedsync.store;

import java.util.List;
import java.util.Optional;

import net.moznion.schedsync.JobEntry;

/**
 * Scheduler store keyed by entry id. {@link #upsert(JobEntry)} is last-write-wins and must be
 * safe to call concurrently for different ids.
 */
public interface JobEntryStore {
    void upsert(JobEntry entry);

    Optional<JobEntry> findById(String id);

    /**
     * @return all stored entries ordered by id
     */
    List<JobEntry> findAll();

    boolean delete(String id);
}
