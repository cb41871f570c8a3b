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

package me.golemcore.support.adapter.outbound.lock;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.ConversationLockPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Distributed conversation lock on Redis: {@code SET key token NX PX hold}
 * to acquire and a compare-and-delete script to release, so a holder whose
 * lease expired cannot release someone else's lock.
 *
 * <p>
 * Acquisition polls until the wait timeout. A Redis error counts as a failed
 * attempt.
 */
@Component
@ConditionalOnProperty(prefix = "support.lock", name = "provider", havingValue = "redis")
@Slf4j
public class RedisConversationLockAdapter implements ConversationLockPort {

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final StringRedisTemplate redisTemplate;
    private final SupportProperties properties;
    private final Clock clock;

    public RedisConversationLockAdapter(StringRedisTemplate redisTemplate, SupportProperties properties,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration holdTime, Duration waitTimeout) {
        String redisKey = properties.getLock().getKeyPrefix() + key;
        String token = UUID.randomUUID().toString();
        long deadlineNanos = System.nanoTime() + waitTimeout.toNanos();

        while (true) {
            try {
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(redisKey, token, holdTime);
                if (Boolean.TRUE.equals(acquired)) {
                    return Optional.of(new LockLease(key, token, clock.instant().plus(holdTime)));
                }
            } catch (RuntimeException e) {
                log.warn("[Lock] Redis error while acquiring {}", redisKey, e);
            }

            if (System.nanoTime() >= deadlineNanos) {
                log.debug("[Lock] Timed out waiting for {}", redisKey);
                return Optional.empty();
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public void release(LockLease lease) {
        if (lease == null) {
            return;
        }
        String redisKey = properties.getLock().getKeyPrefix() + lease.key();
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(redisKey), lease.token());
            if (deleted == null || deleted == 0L) {
                log.debug("[Lock] Lease on {} already expired or taken over", redisKey);
            }
        } catch (RuntimeException e) {
            // The key still expires after its hold time
            log.warn("[Lock] Redis error while releasing {}", redisKey, e);
        }
    }
}
