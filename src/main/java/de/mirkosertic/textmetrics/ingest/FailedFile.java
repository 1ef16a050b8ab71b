package de.mirkosertic.textmetrics.ingest;

import java.nio.file.Path;

/**
 * A file of a batch that could not be read or analyzed.
 */
public record FailedFile(Path file, String error) {
}
