package net.moznion.schedsync.event;

import java.util.Optional;

import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.store.JobEntryStore;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingHandler<T extends JobEntryStore> implements EventHandler<T> {
    @Override
    public void handle(final Event event,
                       final T store,
                       final String entryId,
                       final Optional<JobEntry> entry,
                       final Optional<Throwable> throwable) {
        final long threadId = Thread.currentThread().getId();
        final String name = entry.map(JobEntry::getName).orElse(null);
        final String schedule = entry.map(JobEntry::getSchedule).orElse(null);
        if (throwable.isPresent()) {
            log.warn("{}: threadId={}, entryId={}, name={}, schedule={}",
                     event.name(), threadId, entryId, name, schedule, throwable.get());
        } else {
            log.info("{}: threadId={}, entryId={}, name={}, schedule={}",
                     event.name(), threadId, entryId, name, schedule);
        }
    }
}
