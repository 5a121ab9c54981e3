package net.moznion.schedsync.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import net.moznion.schedsync.JobEntry;

public class InMemoryJobEntryStoreTest {
    @Test
    public void testBasic() {
        final InMemoryJobEntryStore store = new InMemoryJobEntryStore();
        assertThat(store.findAll()).isEmpty();
        assertThat(store.findById("b")).isEmpty();

        store.upsert(entry("b", "0 8 * * *"));
        store.upsert(entry("a", "0 9 * * *"));
        assertThat(store.findAll()).extracting(JobEntry::getId).containsExactly("a", "b");

        store.upsert(entry("b", "0 10 * * *"));
        assertThat(store.findById("b").get().getSchedule()).isEqualTo("0 10 * * *");
        assertThat(store.findAll()).hasSize(2);

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        assertThat(store.findAll()).extracting(JobEntry::getId).containsExactly("b");
    }

    static JobEntry entry(final String id, final String schedule) {
        return JobEntry.builder()
                       .id(id)
                       .name(id)
                       .type("script")
                       .schedule(schedule)
                       .environment("cloud")
                       .status("active")
                       .config("{\"script\":null}")
                       .build();
    }
}
