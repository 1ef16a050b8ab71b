package de.mirkosertic.textmetrics.analysis;

public record TermScore(String term, double score) {
}
