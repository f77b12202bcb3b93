package com.gateway.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.gateway.generator.codegen.model.output.GeneratedFile;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes every generated file below {@code outputDir}.
     *
     * @return the paths written, in order
     */
    public static List<Path> writeAll(Path outputDir, List<GeneratedFile> files) throws IOException {
        Path root = outputDir.toAbsolutePath().normalize();
        List<Path> written = new ArrayList<>();
        for (GeneratedFile file : files) {
            Path target = root.resolve(file.getName()).normalize();
            if (!target.startsWith(root)) {
                throw new IOException("Refusing to write outside of " + root + ": " + file.getName());
            }
            safeWriteString(target, file.getContent());
            written.add(target);
        }
        return written;
    }
}
