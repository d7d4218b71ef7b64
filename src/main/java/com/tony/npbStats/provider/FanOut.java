package com.tony.npbStats.provider;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Seul endroit où la panne d'une source est interprétée comme "cette source n'a rien apporté".
 * <p>
 * {@link #attempt} isole un appel ; {@link #invokeAll} lance des branches en parallèle sous un délai global.
 * Chaque branche renvoie son propre résultat, fusionné par l'appelant après la jointure.
 * Les branches encore en cours à l'échéance sont annulées (interruption).
 */
@Slf4j
public class FanOut {

    private final ExecutorService executor;
    private final Duration deadline;

    public FanOut(ExecutorService executor, Duration deadline) {
        this.executor = executor;
        this.deadline = deadline;
    }

    /**
     * Appel isolé à une source. Vide si la source est en panne de transport.
     */
    public static <T> Optional<T> attempt(String provider, Supplier<T> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (TransportFailureException e) {
            log.warn("⚠️ Source '{}' ignorée : {}", provider, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Lance toutes les branches et attend leur fin (ou l'échéance).
     * Une branche en erreur, annulée ou hors délai donne un résultat vide, sans affecter les autres.
     */
    public <K, T> Map<K, Optional<T>> invokeAll(Map<K, Supplier<T>> branches) {
        List<K> keys = new ArrayList<>(branches.keySet());
        List<Callable<T>> tasks = new ArrayList<>();
        for (K key : keys) {
            Supplier<T> branch = branches.get(key);
            tasks.add(branch::get);
        }

        Map<K, Optional<T>> results = new LinkedHashMap<>();
        try {
            List<Future<T>> futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < keys.size(); i++) {
                results.put(keys.get(i), outcome(keys.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            // invokeAll annule lui-même les branches non terminées
            Thread.currentThread().interrupt();
            log.warn("⏹️ Appel multi-sources interrompu, {} branche(s) abandonnée(s)", keys.size());
            keys.forEach(k -> results.putIfAbsent(k, Optional.empty()));
        }
        return results;
    }

    private <K, T> Optional<T> outcome(K key, Future<T> future) throws InterruptedException {
        try {
            return Optional.ofNullable(future.get());
        } catch (CancellationException e) {
            log.warn("⏱️ Branche '{}' annulée : délai de {} s dépassé", key, deadline.toSeconds());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportFailureException) {
                log.warn("⚠️ Branche '{}' ignorée : {}", key, cause.getMessage());
            } else {
                log.error("❌ Branche '{}' en erreur", key, cause);
            }
            return Optional.empty();
        }
    }
}
