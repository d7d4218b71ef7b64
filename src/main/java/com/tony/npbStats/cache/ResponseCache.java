package com.tony.npbStats.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Cache mémoire des réponses de sources, thread-safe.
 * <p>
 * Chaque entrée porte sa propre durée de vie. Une entrée expirée est ignorée (et évincée) à la lecture suivante.
 * Deux écritures concurrentes sur la même clé : la dernière gagne (les valeurs sont des fonctions pures de leur clé).
 */
@Slf4j
public class ResponseCache {

    private record Entry(Object value, Duration ttl) {
    }

    private final Cache<String, Entry> cache;
    private final boolean enabled;
    private final Duration defaultTtl;

    public ResponseCache(boolean enabled, Duration defaultTtl, long maximumSize) {
        this(enabled, defaultTtl, maximumSize, Ticker.systemTicker());
    }

    public ResponseCache(boolean enabled, Duration defaultTtl, long maximumSize, Ticker ticker) {
        this.enabled = enabled;
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .build();
    }

    /**
     * Clé de taille fixe : empreinte de "opération + arguments ordonnés".
     */
    public static String key(String operation, Object... args) {
        String raw = operation + "|" + Arrays.stream(args).map(String::valueOf).collect(Collectors.joining("|"));
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        if (!enabled) return Optional.empty();
        Entry entry = cache.getIfPresent(key);
        if (entry == null || !type.isInstance(entry.value())) return Optional.empty();
        return Optional.of(type.cast(entry.value()));
    }

    public void put(String key, Object value, Duration ttl) {
        if (!enabled || value == null) return;
        cache.put(key, new Entry(value, ttl));
    }

    public void put(String key, Object value) {
        put(key, value, defaultTtl);
    }

    /**
     * Lecture, sinon calcul puis écriture. Le calcul n'est pas verrouillé : deux appels simultanés
     * peuvent calculer la même valeur.
     */
    public <T> T getOrCompute(String key, Class<T> type, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            log.debug("💾 Cache hit {}", key);
            return cached.get();
        }
        T value = loader.get();
        put(key, value);
        return value;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
