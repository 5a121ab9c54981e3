package net.moznion.schedsync.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import net.moznion.schedsync.JobEntry;
import net.moznion.schedsync.exception.JobStoreException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Keeps entries in one Redis hash per namespace: field is the entry id, value is the entry as JSON.
 * HSET replaces a field atomically, which gives last-write-wins per id.
 */
@Slf4j
public class RedisJobEntryStore implements JobEntryStore, AutoCloseable {
    private final JedisPool jedisPool;
    private final ObjectMapper mapper;
    private final String namespace;

    public RedisJobEntryStore(final String namespace,
                              final String redisHost,
                              final int redisPort,
                              final int redisConnectionNum) {
        final JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(redisConnectionNum);

        jedisPool = new JedisPool(poolConfig, redisHost, redisPort);
        mapper = new ObjectMapper();
        this.namespace = namespace;
    }

    @Override
    public void upsert(final JobEntry entry) {
        final String serializedEntry;
        try {
            serializedEntry = mapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize entry", entry.getId(), e);
        }

        try (final Jedis jedis = jedisPool.getResource()) {
            jedis.hset(getEntriesKey(), entry.getId(), serializedEntry);
        } catch (JedisException e) {
            throw new JobStoreException("Failed to upsert entry", entry.getId(), e);
        }
    }

    @Override
    public Optional<JobEntry> findById(final String id) {
        try (final Jedis jedis = jedisPool.getResource()) {
            final String serializedEntry = jedis.hget(getEntriesKey(), id);
            if (serializedEntry == null) {
                return Optional.empty();
            }
            return Optional.of(deserialize(id, serializedEntry));
        } catch (JedisException e) {
            throw new JobStoreException("Failed to fetch entry", id, e);
        }
    }

    @Override
    public List<JobEntry> findAll() {
        try (final Jedis jedis = jedisPool.getResource()) {
            final Map<String, String> serializedEntries = new TreeMap<>(jedis.hgetAll(getEntriesKey()));
            final List<JobEntry> entries = new ArrayList<>(serializedEntries.size());
            serializedEntries.forEach((id, serializedEntry) -> entries.add(deserialize(id, serializedEntry)));
            return entries;
        } catch (JedisException e) {
            throw new JobStoreException("Failed to fetch entries [namespace=" + namespace + ']', e);
        }
    }

    @Override
    public boolean delete(final String id) {
        try (final Jedis jedis = jedisPool.getResource()) {
            return jedis.hdel(getEntriesKey(), id) != 0;
        } catch (JedisException e) {
            throw new JobStoreException("Failed to delete entry", id, e);
        }
    }

    @Override
    public void close() {
        log.info("Closing Redis connection pool [namespace={}]", namespace);
        jedisPool.close();
    }

    private JobEntry deserialize(final String id, final String serializedEntry) {
        try {
            return mapper.readValue(serializedEntry, JobEntry.class);
        } catch (IOException e) {
            throw new JobStoreException("Broken entry in store", id, e);
        }
    }

    String getEntriesKey() {
        return namespace + "|entries";
    }
}
