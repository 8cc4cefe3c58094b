package com.libragraph.registry.core.resolve;

import com.libragraph.registry.types.AssetType;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Picks the definition file of an asset out of a directory listing.
 *
 * <p>Patterns are tried in precedence order; the first pattern with any match wins and
 * ties within one pattern go to the alphabetically first name. For frameworks:
 * {@code *_framework.yaml}, {@code *_framework.yml}, {@code *_framework.json},
 * {@code framework_consolidated.json}, {@code framework.yaml}, {@code framework.yml},
 * {@code framework.json}. Other types substitute their own file stem.
 */
@ApplicationScoped
public class AssetFileResolver {

    public List<String> patterns(AssetType type) {
        String stem = type.fileStem();
        return List.of(
                "*_" + stem + ".yaml",
                "*_" + stem + ".yml",
                "*_" + stem + ".json",
                stem + "_consolidated.json",
                stem + ".yaml",
                stem + ".yml",
                stem + ".json");
    }

    /**
     * Pure selection over bare file names.
     */
    public Optional<String> select(AssetType type, Collection<String> fileNames) {
        for (String pattern : patterns(type)) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            Optional<String> match = fileNames.stream()
                    .filter(name -> matcher.matches(Path.of(name)))
                    .sorted()
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves {@code location} to a definition file. A regular file is returned as-is,
     * a directory is searched with {@link #select}, anything else resolves to nothing.
     */
    public Optional<Path> locate(AssetType type, Path location) throws IOException {
        if (Files.isRegularFile(location)) {
            return Optional.of(location);
        }
        if (!Files.isDirectory(location)) {
            return Optional.empty();
        }
        List<String> names;
        try (Stream<Path> entries = Files.list(location)) {
            names = entries
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .toList();
        }
        return select(type, names).map(location::resolve);
    }
}
