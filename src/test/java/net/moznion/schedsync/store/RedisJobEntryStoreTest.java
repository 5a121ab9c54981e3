package net.moznion.schedsync.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.exception.JobStoreException;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisConnectionException;

public class RedisJobEntryStoreTest {
    private static final String REDIS_HOST = "127.0.0.1";
    private static final int REDIS_PORT = 6379;
    private static final String NAMESPACE_FOR_TESTING = "schedsync-test";

    private RedisJobEntryStore store;

    @Before
    public void setup() throws Exception {
        Assume.assumeTrue("Redis is not running on " + REDIS_HOST + ':' + REDIS_PORT, isRedisAvailable());
        try (final Jedis jedis = new Jedis(REDIS_HOST, REDIS_PORT)) {
            jedis.keys(NAMESPACE_FOR_TESTING + '*').forEach(jedis::del);
        }
        store = new RedisJobEntryStore(NAMESPACE_FOR_TESTING, REDIS_HOST, REDIS_PORT, 5);
    }

    @After
    public void teardown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    public void testBasic() throws Exception {
        assertThat(store.findAll()).isEmpty();

        final JobEntry entry = JobEntry.builder()
                                       .id("daily-report--lucas")
                                       .name("daily-report")
                                       .type("script")
                                       .schedule("30 9 * * 1-5")
                                       .timezone("America/Los_Angeles")
                                       .environment("cloud")
                                       .status("active")
                                       .config("{\"script\":{\"command\":\"node report.cjs --user=lucas\"},"
                                               + "\"user_id\":\"lucas\"}")
                                       .dependsOn("[\"push-granola-tokens--lucas\"]")
                                       .build();
        store.upsert(entry);
        store.upsert(InMemoryJobEntryStoreTest.entry("a-shared-job", null));

        assertThat(store.findById("daily-report--lucas")).contains(entry);
        assertThat(store.findAll()).extracting(JobEntry::getId).containsExactly("a-shared-job", "daily-report--lucas");

        store.upsert(InMemoryJobEntryStoreTest.entry("a-shared-job", "0 7 * * *"));
        assertThat(store.findById("a-shared-job").get().getSchedule()).isEqualTo("0 7 * * *");

        assertThat(store.delete("a-shared-job")).isTrue();
        assertThat(store.delete("a-shared-job")).isFalse();
        assertThat(store.findById("a-shared-job")).isEmpty();
    }

    @Test
    public void testBrokenEntry() throws Exception {
        try (final Jedis jedis = new Jedis(REDIS_HOST, REDIS_PORT)) {
            jedis.hset(store.getEntriesKey(), "broken", "{not json");
        }
        assertThatThrownBy(() -> store.findById("broken")).isInstanceOf(JobStoreException.class)
                                                          .hasMessageContaining("entryId=broken");
    }

    private static boolean isRedisAvailable() {
        try (final Jedis jedis = new Jedis(REDIS_HOST, REDIS_PORT)) {
            return "PONG".equals(jedis.ping());
        } catch (JedisConnectionException e) {
            return false;
        }
    }
}
