package net.moznion.schedsync.store;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.After;
import org.junit.Test;

import net.moznion.schedsync.exception.JobStoreException;

import redis.clients.jedis.exceptions.JedisConnectionException;

public class RedisJobEntryStoreUnreachableTest {
    // nothing listens on port 1
    private final RedisJobEntryStore store = new RedisJobEntryStore("schedsync-unreachable", "127.0.0.1", 1, 1);

    @After
    public void teardown() {
        store.close();
    }

    @Test
    public void testConnectionFailureIsWrapped() {
        assertThatThrownBy(() -> store.upsert(InMemoryJobEntryStoreTest.entry("a", "0 1 * * *")))
                .isInstanceOf(JobStoreException.class)
                .hasMessageContaining("entryId=a")
                .hasCauseInstanceOf(JedisConnectionException.class);
        assertThatThrownBy(() -> store.findById("a")).isInstanceOf(JobStoreException.class)
                                                     .hasCauseInstanceOf(JedisConnectionException.class);
        assertThatThrownBy(store::findAll).isInstanceOf(JobStoreException.class)
                                          .hasMessageContaining("schedsync-unreachable");
        assertThatThrownBy(() -> store.delete("a")).isInstanceOf(JobStoreException.class);
    }
}
