/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.store.redis;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.errors.StoreUnavailableException;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Redis-backed store client.
 * Features:
 * - JedisPool for concurrent callers, per-operation socket timeout
 * - Batches applied inside MULTI/EXEC
 * - Cursor-based SCAN, never KEYS
 * - Connection failures surface as retryable {@link StoreUnavailableException}
 */
public final class JedisStoreClient implements StoreClient {

    private static final Logger log = LoggerFactory.getLogger(JedisStoreClient.class);

    private static final int DEFAULT_SCAN_COUNT = 500;

    private final JedisPool pool;
    private final MetricsRuntime metrics;
    private final int scanCount;

    public JedisStoreClient(JedisPool pool, MetricsRuntime metrics, int scanCount) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.scanCount = Math.max(1, scanCount);
    }

    public static JedisStoreClient fromConfig(StoreConfig config, MetricsRuntime metrics) {
        // 1. Config
        String host = config.getString("redis.host", "localhost");
        int port = config.getInt("redis.port", 6379);
        String password = config.getString("redis.password", null);
        int timeout = config.getInt("redis.timeout.ms", 2000);

        // 2. Pool Setup
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getInt("redis.pool.max", 64));
        poolConfig.setMaxIdle(config.getInt("redis.pool.idle", 16));
        poolConfig.setMinIdle(config.getInt("redis.pool.min", 2));
        poolConfig.setTestOnBorrow(false);
        poolConfig.setTestWhileIdle(true);

        JedisPool pool;
        if (password != null) {
            pool = new JedisPool(poolConfig, host, port, timeout, password);
        } else {
            pool = new JedisPool(poolConfig, host, port, timeout);
        }

        log.info("Redis store active: {}:{} (timeout={}ms)", host, port, timeout);
        return new JedisStoreClient(pool, metrics, config.getInt("redis.scan.count", DEFAULT_SCAN_COUNT));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return withJedis("HGETALL " + key, j -> {
            Map<String, String> h = j.hgetAll(key);
            return h == null ? Map.of() : h;
        });
    }

    @Override
    public boolean exists(String key) {
        return withJedis("EXISTS " + key, j -> j.exists(key));
    }

    @Override
    public Set<String> smembers(String key) {
        return withJedis("SMEMBERS " + key, j -> {
            Set<String> s = j.smembers(key);
            return s == null ? Set.of() : s;
        });
    }

    @Override
    public long scard(String key) {
        return withJedis("SCARD " + key, j -> j.scard(key));
    }

    @Override
    public Set<String> scan(String pattern) {
        return withJedis("SCAN " + pattern, j -> {
            final ScanParams params = new ScanParams().match(pattern).count(scanCount);
            Set<String> keys = new HashSet<>();
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = j.scan(cursor, params);
                keys.addAll(page.getResult());
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return keys;
        });
    }

    @Override
    public void execute(StoreBatch batch) {
        if (batch.isEmpty()) return;
        withJedis("MULTI/EXEC", j -> {
            Transaction tx = j.multi();
            for (StoreBatch.Op op : batch.ops()) {
                stage(tx, op);
            }
            List<Object> results = tx.exec();
            if (results == null) {
                throw new StoreUnavailableException("Redis transaction aborted", null);
            }
            // EXEC reports per-command errors in place; the other commands have already applied
            for (Object result : results) {
                if (result instanceof JedisException failed) {
                    throw failed;
                }
                if (result instanceof Exception failed) {
                    throw new JedisDataException(failed.getMessage(), failed);
                }
            }
            return results.size();
        });
    }

    private static void stage(Transaction tx, StoreBatch.Op op) {
        if (op instanceof StoreBatch.PutHash put) {
            // Replace, not merge: stale fields must not survive a rewrite
            tx.del(put.key());
            if (!put.fields().isEmpty()) {
                tx.hset(put.key(), put.fields());
            }
        } else if (op instanceof StoreBatch.AddMembers add) {
            tx.sadd(add.key(), add.members().toArray(new String[0]));
        } else if (op instanceof StoreBatch.RemoveMembers rem) {
            tx.srem(rem.key(), rem.members().toArray(new String[0]));
        } else if (op instanceof StoreBatch.Delete del) {
            tx.del(del.key());
        } else {
            throw new IllegalArgumentException("Unsupported batch op: " + op.getClass().getName());
        }
    }

    @Override
    public void ping() {
        withJedis("PING", Jedis::ping);
    }

    private <T> T withJedis(String operation, Function<Jedis, T> body) {
        try (Jedis jedis = pool.getResource()) {
            return body.apply(jedis);
        } catch (JedisConnectionException e) {
            metrics.counter("samsto.store.unavailable");
            throw new StoreUnavailableException("Redis unavailable during " + operation, e);
        } catch (JedisException e) {
            metrics.counter("samsto.store.errors");
            throw new IllegalStateException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
            log.info("Redis store closed.");
        }
    }
}
