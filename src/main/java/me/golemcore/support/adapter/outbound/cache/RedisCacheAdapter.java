/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.support.adapter.outbound.cache;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.port.outbound.CachePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache shared by all workers. Redis errors are logged and
 * reported as a miss so the durable store stays the source of truth.
 */
@Component
@ConditionalOnProperty(prefix = "support.cache", name = "provider", havingValue = "redis")
@Slf4j
public class RedisCacheAdapter implements CachePort {

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOperations;

    public RedisCacheAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.valueOperations = redisTemplate.opsForValue();
    }

    @Override
    public Optional<String> get(String key) {
        if (!StringUtils.hasText(key)) {
            return Optional.empty();
        }
        try {
            String value = valueOperations.get(key);
            return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Cache] Failed to read {} from Redis", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (!StringUtils.hasText(key) || value == null) {
            return;
        }
        try {
            if (ttl != null) {
                valueOperations.set(key, value, ttl);
            } else {
                valueOperations.set(key, value);
            }
        } catch (RuntimeException e) {
            log.warn("[Cache] Failed to store {} in Redis", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (!StringUtils.hasText(key)) {
            return;
        }
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            // A stale entry may survive until its TTL
            log.warn("[Cache] Failed to delete {} from Redis", key, e);
        }
    }
}
