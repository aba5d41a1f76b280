package com.shortener.repository;

import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Lua scripts executed atomically in Redis.
 */
final class RedisScripts {

    private RedisScripts() {}

    /**
     * Insert a record only if its short code is free.
     *
     * KEYS[1] = url:{shortCode}
     * KEYS[2] = urls:by-created (sorted set, score = createdAt epoch micros)
     * KEYS[3] = urls:by-original (hash originalUrl -> shortCode)
     *
     * ARGV[1] = shortCode
     * ARGV[2] = originalUrl
     * ARGV[3] = createdAt as ISO-8601 instant
     * ARGV[4] = createdAt epoch micros
     *
     * Returns: 1 when inserted, 0 when the code is already taken.
     */
    static final RedisScript<Long> INSERT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then " +
            "    return 0 " +
            "end " +
            "redis.call('HSET', KEYS[1], 'original_url', ARGV[2], 'created_at', ARGV[3], 'access_count', 0) " +
            "redis.call('ZADD', KEYS[2], ARGV[4], ARGV[1]) " +
            // first record for a URL stays canonical
            "redis.call('HSETNX', KEYS[3], ARGV[2], ARGV[1]) " +
            "return 1",
            Long.class);

    /**
     * Increment the access count of an existing record.
     *
     * KEYS[1] = url:{shortCode}
     *
     * Returns: the new count, or -1 if the record does not exist.
     */
    static final RedisScript<Long> INCREMENT_ACCESS_COUNT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then " +
            "    return -1 " +
            "end " +
            "return redis.call('HINCRBY', KEYS[1], 'access_count', 1)",
            Long.class);
}
