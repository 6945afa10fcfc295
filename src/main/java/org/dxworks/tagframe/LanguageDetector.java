package org.dxworks.tagframe;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        Path fileNamePath = filePath.getFileName();
        if (fileNamePath == null) {
            return Optional.empty();
        }
        String fileName = fileNamePath.toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".html") || fileName.endsWith(".htm") || fileName.endsWith(".xhtml")) {
            return Optional.of(Language.HTML);
        } else if (fileName.endsWith(".cshtml") || fileName.endsWith(".razor")) {
            return Optional.of(Language.RAZOR);
        } else if (fileName.endsWith(".md") || fileName.endsWith(".markdown")) {
            return Optional.of(Language.MARKDOWN);
        }

        return Optional.empty();
    }
}
