package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects the {@link Diagnostic diagnostics} of one analysis call. Not thread-safe, create one per call.
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void add(final String component, final String message) {
        entries.add(new Diagnostic(component, message));
    }

    public void addAll(final Collection<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Diagnostic> toList() {
        return List.copyOf(entries);
    }
}
