package io.github.cyfko.logictree.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedLRUCache Tests")
class BoundedLRUCacheTest {

    private BoundedLRUCache<String, Integer> cache;

    @BeforeEach
    void setUp() {
        cache = new BoundedLRUCache<>(2);
    }

    @Test
    @DisplayName("Evicts the least recently used entry")
    void evictsLeastRecentlyUsed() {
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Counts hits and misses")
    void countsHitsAndMisses() {
        cache.put("a", 1);

        assertEquals(1, cache.get("a"));
        assertNull(cache.get("z"));

        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
        assertEquals("BoundedLRUCache[size=1, maxSize=2, hits=1, misses=1]", cache.getStats());
    }

    @Test
    @DisplayName("clear resets entries and counters")
    void clear() {
        cache.put("a", 1);
        cache.get("a");
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, cache.getHits());
        assertEquals(0, cache.getMisses());
    }

    @Test
    @DisplayName("Rejects invalid arguments")
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, Integer>(0));
        assertThrows(IllegalArgumentException.class, () -> cache.put("a", null));
        assertEquals(2, cache.getMaxSize());
    }
}
