package net.moznion.schedsync.event;

import java.util.Optional;

import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.store.JobEntryStore;

@FunctionalInterface
public interface EventHandler<T extends JobEntryStore> {
    /**
     * @param entry the entry being synced; empty for {@link Event#REMOVED}
     * @param throwable cause of a {@link Event#FAILED} event
     */
    void handle(Event event,
                T store,
                String entryId,
                Optional<JobEntry> entry,
                Optional<Throwable> throwable);
}
