package de.mirkosertic.textmetrics.analysis;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of loading one language resource: either the resource or the reason it is unavailable.
 *
 * @param language the normalized language code
 * @param value    the loaded resource, null if unavailable
 * @param failure  why the resource is unavailable, null if loaded
 * @param <T>      resource type
 */
public record LanguageResource<T>(String language, @Nullable T value, @Nullable String failure) {

    public static <T> LanguageResource<T> loaded(final String language, final T value) {
        return new LanguageResource<>(language, value, null);
    }

    public static <T> LanguageResource<T> unavailable(final String language, final String failure) {
        return new LanguageResource<>(language, null, failure);
    }

    public boolean isAvailable() {
        return value != null;
    }

    /**
     * @return the resource
     * @throws ResourceUnavailableException if the resource could not be loaded
     */
    public T orElseThrow() {
        if (value == null) {
            throw new ResourceUnavailableException(failure);
        }
        return value;
    }
}
