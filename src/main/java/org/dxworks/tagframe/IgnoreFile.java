package org.dxworks.tagframe;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Glob patterns from a {@code .ignore} file, one per line. Blank lines and lines starting
 * with {@code #} are skipped. A path is accepted unless its absolute form matches one of
 * the patterns, e.g. {@code **}{@code /node_modules/**} or {@code **.min.html}.
 */
public final class IgnoreFile {

    private static final IgnoreFile EMPTY = new IgnoreFile(List.of());

    private final List<PathMatcher> matchers;

    private IgnoreFile(List<PathMatcher> matchers) {
        this.matchers = matchers;
    }

    public static IgnoreFile empty() {
        return EMPTY;
    }

    public static IgnoreFile load(Path ignoreFile) {
        if (!Files.isRegularFile(ignoreFile)) {
            return EMPTY;
        }
        try {
            return of(Files.readAllLines(ignoreFile));
        } catch (IOException e) {
            System.err.println("Could not read " + ignoreFile + ", nothing is ignored: " + e.getMessage());
            return EMPTY;
        }
    }

    public static IgnoreFile of(List<String> lines) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String line : lines) {
            String pattern = line.strip();
            if (pattern.isEmpty() || pattern.startsWith("#")) continue;
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        return new IgnoreFile(List.copyOf(matchers));
    }

    public boolean accepts(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(absolute)) {
                return false;
            }
        }
        return true;
    }
}
