package com.tony.npbStats.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private final AtomicLong now = new AtomicLong();
    private final ResponseCache cache = new ResponseCache(true, Duration.ofHours(6), 100, now::get);

    private void advance(Duration duration) {
        now.addAndGet(duration.toNanos());
    }

    @Test
    @DisplayName("Clé stable, de taille fixe, sensible à l'ordre des arguments")
    void key_ShouldBeDeterministicDigest() {
        String key = ResponseCache.key("stats", "npb_murakami_2024", 2024, null);

        assertThat(key).hasSize(32).isEqualTo(ResponseCache.key("stats", "npb_murakami_2024", 2024, null));
        assertThat(ResponseCache.key("stats", 2024, "npb_murakami_2024", null)).isNotEqualTo(key);
    }

    @Test
    @DisplayName("Une entrée expire après sa propre durée de vie")
    void entry_ShouldExpireAfterItsTtl() {
        // ARRANGE
        cache.put("court", "valeur", Duration.ofMinutes(10));
        cache.put("long", "valeur");

        // ACT
        advance(Duration.ofMinutes(9));
        assertThat(cache.get("court", String.class)).contains("valeur");
        advance(Duration.ofMinutes(2));

        // ASSERT
        assertThat(cache.get("court", String.class)).isEmpty();
        assertThat(cache.get("long", String.class)).contains("valeur");
        advance(Duration.ofHours(6));
        assertThat(cache.get("long", String.class)).isEmpty();
    }

    @Test
    @DisplayName("getOrCompute ne recalcule pas une valeur en cache")
    void getOrCompute_ShouldCallLoaderOnce() {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrCompute("k", String.class, () -> "v" + calls.incrementAndGet());
        String second = cache.getOrCompute("k", String.class, () -> "v" + calls.incrementAndGet());

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(calls).hasValue(1);
        assertThat(cache.get("k", Integer.class)).isEmpty(); // mauvais type
    }

    @Test
    @DisplayName("Cache désactivé : chaque appel recalcule")
    void disabledCache_ShouldAlwaysCompute() {
        ResponseCache disabled = new ResponseCache(false, Duration.ofHours(1), 100);
        AtomicInteger calls = new AtomicInteger();

        disabled.getOrCompute("k", Integer.class, calls::incrementAndGet);
        disabled.getOrCompute("k", Integer.class, calls::incrementAndGet);

        assertThat(calls).hasValue(2);
        assertThat(disabled.size()).isZero();
    }
}
