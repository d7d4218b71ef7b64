package com.tony.npbStats.provider;

import lombok.Getter;

/**
 * Panne de transport d'une source : timeout, erreur réseau ou réponse illisible.
 */
@Getter
public class TransportFailureException extends RuntimeException {

    private final String provider;

    public TransportFailureException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    public TransportFailureException(String provider, String message) {
        this(provider, message, null);
    }
}
