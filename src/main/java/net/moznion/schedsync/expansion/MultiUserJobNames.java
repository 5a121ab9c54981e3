package net.moznion.schedsync.expansion;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import net.moznion.schedsync.JobDefinition;

public final class MultiUserJobNames {
    private MultiUserJobNames() {
    }

    /**
     * Names of the jobs flagged {@code multi_user}, in definition order.
     */
    public static Set<String> of(final Collection<JobDefinition> jobs) {
        final LinkedHashSet<String> names = new LinkedHashSet<>();
        for (final JobDefinition job : jobs) {
            if (job.isPerUser()) {
                names.add(job.getName());
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
