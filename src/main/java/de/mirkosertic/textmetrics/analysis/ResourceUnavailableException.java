package de.mirkosertic.textmetrics.analysis;

/**
 * Thrown when a language resource (tokenizer model, stopword list) is missing,
 * unreadable or not supported for the requested language.
 * <p>
 * Never escapes the engine: callers inside the engine react by switching to the
 * next tokenizer tier or to the built-in stopword fallback.
 */
public class ResourceUnavailableException extends RuntimeException {

    public ResourceUnavailableException(final String message) {
        super(message);
    }

    public ResourceUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
