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
import java.util.Optional;

/**
 * Volatile key/value cache with per-entry time-to-live. Values are strings
 * (JSON), so both in-process and Redis implementations can back it.
 *
 * <p>
 * Implementations must not throw on backend failure: a broken cache behaves
 * like an empty one.
 */
public interface CachePort {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
