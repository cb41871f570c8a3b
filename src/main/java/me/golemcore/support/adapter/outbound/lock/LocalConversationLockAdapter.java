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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.port.outbound.ConversationLockPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-process conversation lock with lease expiry.
 *
 * <p>
 * Waiters block on a single monitor and are woken on every release; a lease
 * whose hold time has passed is treated as free.
 */
@Component
@ConditionalOnProperty(prefix = "support.lock", name = "provider", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LocalConversationLockAdapter implements ConversationLockPort {

    private final Clock clock;

    private final Object monitor = new Object();
    private final Map<String, LockLease> leases = new HashMap<>();

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration holdTime, Duration waitTimeout) {
        long deadlineNanos = System.nanoTime() + waitTimeout.toNanos();
        synchronized (monitor) {
            while (true) {
                Instant now = clock.instant();
                LockLease current = leases.get(key);
                if (current == null || !now.isBefore(current.expiresAt())) {
                    if (current != null) {
                        log.warn("[Lock] Lease on {} expired without release, taking over", key);
                    }
                    LockLease lease = new LockLease(key, UUID.randomUUID().toString(), now.plus(holdTime));
                    leases.put(key, lease);
                    return Optional.of(lease);
                }

                long remainingNanos = deadlineNanos - System.nanoTime();
                if (remainingNanos <= 0) {
                    log.debug("[Lock] Timed out waiting for {}", key);
                    return Optional.empty();
                }
                long untilExpiryNanos = Duration.between(now, current.expiresAt()).toNanos();
                long waitNanos = Math.max(1, Math.min(remainingNanos, untilExpiryNanos));
                try {
                    monitor.wait(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
        }
    }

    @Override
    public void release(LockLease lease) {
        if (lease == null) {
            return;
        }
        synchronized (monitor) {
            LockLease current = leases.get(lease.key());
            if (current != null && current.token().equals(lease.token())) {
                leases.remove(lease.key());
            } else {
                log.debug("[Lock] Ignoring release of stale lease on {}", lease.key());
            }
            monitor.notifyAll();
        }
    }
}
