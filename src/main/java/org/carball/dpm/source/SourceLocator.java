package org.carball.dpm.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.exception.DatabaseNotFoundException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the source database. A file path is used as is; a directory is searched
 * recursively and a file whose name contains the preferred keyword wins over the
 * first match.
 */
@Slf4j
public class SourceLocator {

    private final List<String> extensions;
    private final String keyword;

    public SourceLocator(List<String> extensions, String keyword) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.keyword = keyword == null ? "" : keyword.toLowerCase(Locale.ROOT);
    }

    public Path locate(Path source) {
        if (Files.isRegularFile(source)) {
            return source;
        }
        if (!Files.isDirectory(source)) {
            throw new DatabaseNotFoundException(source);
        }
        return findDatabase(source).orElseThrow(() -> new DatabaseNotFoundException(source));
    }

    Optional<Path> findDatabase(Path directory) {
        List<Path> databases;
        try (Stream<Path> files = Files.walk(directory)) {
            databases = files
                    .filter(Files::isRegularFile)
                    .filter(this::hasDatabaseExtension)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search " + directory, e);
        }

        if (!keyword.isEmpty()) {
            Optional<Path> preferred = databases.stream()
                    .filter(p -> baseName(p).contains(keyword))
                    .findFirst();
            if (preferred.isPresent()) {
                return preferred;
            }
        }

        if (databases.isEmpty()) {
            log.warn("No database found in {}", directory);
            return Optional.empty();
        }
        log.warn("No database named after '{}' found in {}, using first match {}", keyword, directory, databases.get(0));
        return Optional.of(databases.get(0));
    }

    private boolean hasDatabaseExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
