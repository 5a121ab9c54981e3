package net.moznion.schedsync.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

import net.moznion.schedsync.JobEntry;

public class InMemoryJobEntryStore implements JobEntryStore {
    private final ConcurrentSkipListMap<String, JobEntry> entries = new ConcurrentSkipListMap<>();

    @Override
    public void upsert(final JobEntry entry) {
        entries.put(entry.getId(), entry);
    }

    @Override
    public Optional<JobEntry> findById(final String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public List<JobEntry> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public boolean delete(final String id) {
        return entries.remove(id) != null;
    }
}
