package net.moznion.schedsync.sync;

import static net.moznion.schedsync.event.Event.FAILED;
import static net.moznion.schedsync.event.Event.REMOVED;
import static net.moznion.schedsync.event.Event.UNCHANGED;
import static net.moznion.schedsync.event.Event.UPSERTED;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.event.Event;
import net.moznion.schedsync.event.EventHandler;
import net.moznion.schedsync.store.JobEntryStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Upserts scheduler entries into a store, keyed by entry id.
 * <p>
 * Each id is synced by its own task on a fixed pool of workers, so a failing upsert does not hold
 * back the others. Syncing the same entries again converges to the same stored state.
 */
@Slf4j
public class SyncOrchestrator<T extends JobEntryStore> {
    private final T store;
    private final int workerNum;
    private final ConcurrentHashMap<Event, List<EventHandler<T>>> eventHandlerMap;

    private final ThreadFactory threadFactory = Executors.defaultThreadFactory();

    public SyncOrchestrator(final T store, final int workerNum) {
        if (workerNum <= 0) {
            throw new IllegalArgumentException("workerNum must be positive [workerNum=" + workerNum + ']');
        }
        this.store = store;
        this.workerNum = workerNum;

        final Event[] events = Event.values();
        eventHandlerMap = new ConcurrentHashMap<>(events.length);
        for (final Event event : events) {
            eventHandlerMap.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public void addEventHandler(final Event event, final EventHandler<T> handler) {
        eventHandlerMap.get(event).add(handler);
    }

    public void setEventHandler(final Event event, final EventHandler<T> handler) {
        final CopyOnWriteArrayList<EventHandler<T>> newHandlers = new CopyOnWriteArrayList<>();
        newHandlers.add(handler);
        eventHandlerMap.put(event, newHandlers);
    }

    public void clearEventHandler(final Event event) {
        eventHandlerMap.put(event, new CopyOnWriteArrayList<>());
    }

    public SyncResult sync(final List<JobEntry> entries) throws InterruptedException {
        return sync(entries, false);
    }

    /**
     * Upserts every entry. When an id occurs more than once the last occurrence wins.
     *
     * @param prune also delete stored entries whose id is not among {@code entries}; skipped when
     *              any upsert failed
     */
    public SyncResult sync(final List<JobEntry> entries, final boolean prune) throws InterruptedException {
        final LinkedHashMap<String, JobEntry> latestEntries = new LinkedHashMap<>();
        for (final JobEntry entry : entries) {
            latestEntries.put(entry.getId(), entry);
        }
        if (latestEntries.size() < entries.size()) {
            log.warn("Duplicated entry ids in sync batch, the last ones win [entries={}, unique={}]",
                     entries.size(), latestEntries.size());
        }

        final Outcomes outcomes = new Outcomes();
        final List<Callable<Void>> tasks = new ArrayList<>(latestEntries.size());
        for (final JobEntry entry : latestEntries.values()) {
            tasks.add(() -> {
                syncEntry(entry, outcomes);
                return null;
            });
        }

        final ExecutorService executorService =
                Executors.newFixedThreadPool(Math.max(1, Math.min(workerNum, tasks.size())), threadFactory);
        try {
            for (final Future<Void> future : executorService.invokeAll(tasks)) {
                future.get();
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sync worker died", e.getCause());
        } finally {
            executorService.shutdown();
        }

        if (prune) {
            if (outcomes.failures.isEmpty()) {
                prune(latestEntries, outcomes);
            } else {
                log.warn("Skip pruning since some entries failed to sync [failed={}]", outcomes.failures.size());
            }
        }

        final SyncResult result = outcomes.toResult();
        log.info("Synced entries [upserted={}, unchanged={}, removed={}, failed={}, pruneFailed={}]",
                 result.getUpserted().size(), result.getUnchanged().size(),
                 result.getRemoved().size(), result.getFailures().size(), result.getPruneFailure().isPresent());
        return result;
    }

    private void syncEntry(final JobEntry entry, final Outcomes outcomes) {
        final String id = entry.getId();
        final Event event;
        try {
            final Optional<JobEntry> stored = store.findById(id);
            if (stored.isPresent() && stored.get().equals(entry)) {
                event = UNCHANGED;
            } else {
                store.upsert(entry);
                event = UPSERTED;
            }
        } catch (RuntimeException e) {
            log.error("Failed to sync entry [entryId={}]", id, e);
            outcomes.failures.put(id, e);
            handleEvent(FAILED, id, Optional.of(entry), Optional.of(e));
            return;
        }

        if (event == UPSERTED) {
            outcomes.upserted.add(id);
        } else {
            outcomes.unchanged.add(id);
        }
        handleEvent(event, id, Optional.of(entry), Optional.empty());
    }

    private void prune(final Map<String, JobEntry> latestEntries, final Outcomes outcomes) {
        final List<JobEntry> storedEntries;
        try {
            storedEntries = store.findAll();
        } catch (RuntimeException e) {
            log.error("Failed to list stored entries, skip pruning", e);
            outcomes.pruneFailure = e;
            return;
        }

        for (final JobEntry stored : storedEntries) {
            final String id = stored.getId();
            if (latestEntries.containsKey(id)) {
                continue;
            }

            try {
                if (store.delete(id)) {
                    outcomes.removed.add(id);
                    handleEvent(REMOVED, id, Optional.empty(), Optional.empty());
                }
            } catch (RuntimeException e) {
                log.error("Failed to remove stale entry [entryId={}]", id, e);
                outcomes.failures.put(id, e);
                handleEvent(FAILED, id, Optional.empty(), Optional.of(e));
            }
        }
    }

    private void handleEvent(final Event event,
                             final String entryId,
                             final Optional<JobEntry> entry,
                             final Optional<Throwable> throwable) {
        for (final EventHandler<T> handler : eventHandlerMap.get(event)) {
            try {
                handler.handle(event, store, entryId, entry, throwable);
            } catch (RuntimeException e) {
                log.error("Event handler failed [event={}, entryId={}]", event, entryId, e);
            }
        }
    }

    private static class Outcomes {
        private final ConcurrentLinkedQueue<String> upserted = new ConcurrentLinkedQueue<>();
        private final ConcurrentLinkedQueue<String> unchanged = new ConcurrentLinkedQueue<>();
        private final ConcurrentLinkedQueue<String> removed = new ConcurrentLinkedQueue<>();
        private final ConcurrentHashMap<String, Throwable> failures = new ConcurrentHashMap<>();
        private volatile Throwable pruneFailure;

        private SyncResult toResult() {
            return new SyncResult(sorted(upserted),
                                  sorted(unchanged),
                                  sorted(removed),
                                  Collections.unmodifiableMap(new TreeMap<>(failures)),
                                  pruneFailure);
        }

        private static List<String> sorted(final ConcurrentLinkedQueue<String> ids) {
            final List<String> list = new ArrayList<>(ids);
            Collections.sort(list);
            return Collections.unmodifiableList(list);
        }
    }
}
