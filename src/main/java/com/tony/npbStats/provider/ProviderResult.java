package com.tony.npbStats.provider;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;
import java.util.function.Function;

/**
 * Résultat explicite d'un appel à une source : trouvé, introuvable, ou non supporté.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProviderResult<T> {

    public enum Status { FOUND, NOT_FOUND, UNSUPPORTED }

    private final Status status;
    private final T value;
    private final String message;

    public static <T> ProviderResult<T> found(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Un résultat trouvé ne peut pas être vide");
        }
        return new ProviderResult<>(Status.FOUND, value, null);
    }

    public static <T> ProviderResult<T> notFound(String message) {
        return new ProviderResult<>(Status.NOT_FOUND, null, message);
    }

    public static <T> ProviderResult<T> unsupported(String message) {
        return new ProviderResult<>(Status.UNSUPPORTED, null, message);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isUnsupported() {
        return status == Status.UNSUPPORTED;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }

    public <R> ProviderResult<R> map(Function<T, R> mapper) {
        return isFound() ? found(mapper.apply(value)) : new ProviderResult<>(status, null, message);
    }
}
