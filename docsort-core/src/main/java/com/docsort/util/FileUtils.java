package com.docsort.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File utilities for detecting scan types and walking input folders.
 */
public final class FileUtils {

    private FileUtils() {}

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".tiff", ".tif", ".bmp", ".gif", ".webp"
    );

    private static final Set<String> PDF_EXTENSIONS = Set.of(".pdf");

    /** Supported file type categories. */
    public enum FileType { IMAGE, PDF, UNKNOWN }

    /**
     * Detect file type from extension.
     */
    public static FileType detectType(Path file) {
        String ext = extension(file);
        if (IMAGE_EXTENSIONS.contains(ext)) return FileType.IMAGE;
        if (PDF_EXTENSIONS.contains(ext))   return FileType.PDF;
        return FileType.UNKNOWN;
    }

    /**
     * Lower-case extension including the dot, or "" when there is none.
     */
    public static String extension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    /**
     * Split a file name into base and extension (without the dot).
     * {@code "scan.final.PDF"} gives {@code ["scan.final", "PDF"]}.
     */
    public static String[] splitName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) return new String[] { fileName, "" };
        return new String[] { fileName.substring(0, dot), fileName.substring(dot + 1) };
    }

    /**
     * All regular files below a directory, recursively, in path order.
     *
     * @throws IOException if the directory cannot be walked
     */
    public static List<Path> listFiles(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
