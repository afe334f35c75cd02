package com.cpparchitect.core.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds source files below a root directory.
     *
     * <p>A file matches when its name ends with one of the extensions (case-insensitive)
     * and no directory between the root and the file is named in {@code ignoredDirectories}.
     *
     * @param rootPath root directory to search from
     * @param extensions accepted extensions with leading dot, e.g. ".cpp"
     * @param ignoredDirectories directory names to skip
     * @return matching paths, sorted by their file id
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findSourceFiles(Path rootPath, Collection<String> extensions,
                                             Collection<String> ignoredDirectories) throws IOException {
        List<String> suffixes = extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !isInIgnoredDirectory(rootPath.relativize(path), ignoredDirectories))
                .filter(path -> hasExtension(path, suffixes))
                .sorted(Comparator.comparing(path -> toFileId(rootPath, path)))
                .toList();
        }
    }

    /**
     * Converts a path to a root-relative identifier with forward slashes.
     *
     * @param rootPath scanned root
     * @param path file below the root
     * @return file identifier, e.g. {@code src/geometry/shape.cpp}
     */
    public static String toFileId(Path rootPath, Path path) {
        Path relative = rootPath.relativize(path);
        return relative.toString().replace('\\', '/');
    }

    /**
     * Reads a file as UTF-8, replacing malformed byte sequences instead of failing.
     *
     * <p>Legacy C++ sources frequently contain Latin-1 comments; they should not make the
     * whole file unreadable.
     *
     * @param path path to file
     * @return decoded content
     * @throws IOException if reading fails
     */
    public static String readLenient(Path path) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(path))).toString();
    }

    private static boolean isInIgnoredDirectory(Path relativePath, Collection<String> ignoredDirectories) {
        Path parent = relativePath.getParent();
        if (parent == null) {
            return false;
        }
        for (Path segment : parent) {
            if (ignoredDirectories.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasExtension(Path path, List<String> suffixes) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return suffixes.stream().anyMatch(name::endsWith);
    }
}
