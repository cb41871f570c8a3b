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

package me.golemcore.support.port.outbound;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutual exclusion keyed by conversation. A lease expires after its hold time
 * even if never released, so a crashed holder cannot block a conversation
 * forever.
 */
public interface ConversationLockPort {

    /**
     * Waits up to {@code waitTimeout} for the lock.
     *
     * @return the lease, or empty if the lock could not be acquired in time
     */
    Optional<LockLease> tryAcquire(String key, Duration holdTime, Duration waitTimeout);

    /**
     * Releases the lease if it is still the current holder. Releasing an expired
     * or foreign lease is a no-op.
     */
    void release(LockLease lease);

    /**
     * Proof of lock ownership.
     */
    record LockLease(String key, String token, Instant expiresAt) {
        public LockLease {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }
}
