package me.golemcore.support.adapter.outbound.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InMemoryCacheAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private Clock clock;
    private InMemoryCacheAdapter cache;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        cache = new InMemoryCacheAdapter(clock);
    }

    @Test
    void setAndGet() {
        cache.set("key", "value", Duration.ofSeconds(30));

        assertEquals("value", cache.get("key").orElseThrow());
    }

    @Test
    void get_expiredEntryIsMissAndEvicted() {
        cache.set("key", "value", Duration.ofSeconds(30));
        when(clock.instant()).thenReturn(NOW.plusSeconds(30));

        assertTrue(cache.get("key").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void set_evictsOtherExpiredEntries() {
        cache.set("old", "value", Duration.ofSeconds(5));
        when(clock.instant()).thenReturn(NOW.plusSeconds(10));

        cache.set("new", "value", Duration.ofSeconds(5));

        assertEquals(1, cache.size());
    }

    @Test
    void set_ignoresNonPositiveTtlAndNulls() {
        cache.set("zero", "value", Duration.ZERO);
        cache.set("negative", "value", Duration.ofSeconds(-1));
        cache.set("none", "value", null);
        cache.set(null, "value", Duration.ofSeconds(5));
        cache.set("nullValue", null, Duration.ofSeconds(5));

        assertEquals(0, cache.size());
    }

    @Test
    void delete_removesEntry() {
        cache.set("key", "value", Duration.ofSeconds(30));

        cache.delete("key");
        cache.delete(null);

        assertTrue(cache.get("key").isEmpty());
        assertTrue(cache.get(null).isEmpty());
    }
}
