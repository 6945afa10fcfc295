package org.dxworks.tagframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreFileTest {

    @TempDir
    Path tempDir;

    @Test
    void globsRejectMatchingPaths() {
        IgnoreFile ignoreFile = IgnoreFile.of(List.of("**/node_modules/**", "**.min.html"));

        assertFalse(ignoreFile.accepts(tempDir.resolve("node_modules/pkg/index.html")));
        assertFalse(ignoreFile.accepts(tempDir.resolve("dist/app.min.html")));
        assertTrue(ignoreFile.accepts(tempDir.resolve("src/index.html")));
    }

    @Test
    void relativePathsAreMatchedInAbsoluteForm() {
        IgnoreFile ignoreFile = IgnoreFile.of(List.of("**/build/**"));

        assertFalse(ignoreFile.accepts(Path.of("build", "out.html")));
        assertFalse(ignoreFile.accepts(Path.of("src", "..", "build", "out.html")));
        assertTrue(ignoreFile.accepts(Path.of("src", "out.html")));
    }

    @Test
    void loadSkipsCommentsAndBlankLines() throws IOException {
        Path file = tempDir.resolve(".ignore");
        Files.writeString(file, "# generated\n\n   \n**/generated/**\n");

        IgnoreFile ignoreFile = IgnoreFile.load(file);

        assertFalse(ignoreFile.accepts(tempDir.resolve("generated/page.html")));
        assertTrue(ignoreFile.accepts(tempDir.resolve("# generated")));
    }

    @Test
    void missingFileIgnoresNothing() {
        IgnoreFile ignoreFile = IgnoreFile.load(tempDir.resolve("absent"));

        assertSame(IgnoreFile.empty(), ignoreFile);
        assertTrue(ignoreFile.accepts(tempDir.resolve("node_modules/x.html")));
    }
}
