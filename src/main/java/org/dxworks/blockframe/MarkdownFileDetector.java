package org.dxworks.blockframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class MarkdownFileDetector {

    private static final List<String> EXTENSIONS = List.of(".md", ".markdown", ".mdown", ".mkd");

    public static boolean isMarkdown(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
