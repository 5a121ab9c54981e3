package net.moznion.schedsync.sync;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Value;

/**
 * Outcome of one sync run. Id lists are sorted; {@code failures} maps an entry id to the reason its
 * upsert or removal failed. A failure to list the stored entries while pruning has no entry id and
 * is reported through {@link #getPruneFailure()}.
 */
@Value
public class SyncResult {
    List<String> upserted;
    List<String> unchanged;
    List<String> removed;
    Map<String, Throwable> failures;
    Throwable pruneFailure;

    public Optional<Throwable> getPruneFailure() {
        return Optional.ofNullable(pruneFailure);
    }

    public boolean isSuccessful() {
        return failures.isEmpty() && pruneFailure == null;
    }
}
