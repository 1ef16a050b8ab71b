package de.mirkosertic.textmetrics.ingest;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files of a walked directory are analyzed.
 * <p>
 * Exclude globs are matched against the whole path (e.g. {@code **}{@code /.git/**}),
 * include globs against the file name only (e.g. {@code *.docx}).
 * An empty include list accepts every file that is not excluded.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = compile(includePatterns);
        this.excludeMatchers = compile(excludePatterns);
    }

    private static List<PathMatcher> compile(final List<String> patterns) {
        return patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        final Path absolute = file.toAbsolutePath();
        if (excludeMatchers.stream().anyMatch(matcher -> matcher.matches(absolute))) {
            return false;
        }
        final Path fileName = file.getFileName();
        return includeMatchers.isEmpty()
                || (fileName != null && includeMatchers.stream().anyMatch(matcher -> matcher.matches(fileName)));
    }
}
