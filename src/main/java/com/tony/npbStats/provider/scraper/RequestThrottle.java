package com.tony.npbStats.provider.scraper;

import java.time.Duration;

/**
 * Délai minimum entre deux requêtes d'une même instance de scraper.
 * Les appelants concurrents passent les uns après les autres, aucun ne saute l'attente.
 */
public class RequestThrottle {

    private final long delayNanos;
    private boolean firstRequest = true;
    private long lastRequestTime;

    public RequestThrottle(Duration delay) {
        this.delayNanos = delay.toNanos();
    }

    /**
     * @throws InterruptedException appelant déjà interrompu (aucune requête ne doit partir) ou interrompu pendant l'attente
     */
    public synchronized void respectRateLimit() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Appelant interrompu avant la requête");
        }
        if (!firstRequest) {
            long elapsed = System.nanoTime() - lastRequestTime;
            long remaining = delayNanos - elapsed;
            if (remaining > 0) {
                Thread.sleep(remaining / 1_000_000, (int) (remaining % 1_000_000));
            }
        }
        firstRequest = false;
        lastRequestTime = System.nanoTime();
    }
}
