package de.mirkosertic.textmetrics.analysis;

public record TermCount(String term, int count) {
}
