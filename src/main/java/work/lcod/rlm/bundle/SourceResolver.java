package work.lcod.rlm.bundle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.rlm.task.ContextSource;

/**
 * Expands context sources into the sorted, deduplicated list of files a bundle is built from.
 */
final class SourceResolver {
    private SourceResolver() {}

    static List<SourceFile> resolve(List<ContextSource> sources, Path workspaceRoot) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        Map<String, SourceFile> seen = new LinkedHashMap<>();
        for (ContextSource source : sources) {
            for (Path candidate : candidates(source, root)) {
                String relative = relativize(root, candidate);
                if (!source.include().isEmpty() && source.include().stream().noneMatch(p -> Glob.matches(p, relative))) {
                    continue;
                }
                if (source.exclude().stream().anyMatch(p -> Glob.matches(p, relative))) {
                    continue;
                }
                seen.putIfAbsent(relative, new SourceFile(candidate, relative));
            }
        }
        List<SourceFile> resolved = new ArrayList<>(seen.values());
        resolved.sort(Comparator.comparing(SourceFile::relativePath));
        return resolved;
    }

    private static List<Path> candidates(ContextSource source, Path root) {
        Path configured = Path.of(expandHome(source.path()));
        Path absolute = (configured.isAbsolute() ? configured : root.resolve(configured)).normalize();
        switch (source.type()) {
            case "dir", "snapshot" -> {
                if (!Files.isDirectory(absolute)) {
                    throw new BundleException("Context source directory not found: " + source.path());
                }
                try (Stream<Path> walk = Files.walk(absolute)) {
                    return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
                } catch (IOException ex) {
                    throw new BundleException("Unable to list context source " + source.path() + ": " + ex.getMessage(), ex);
                }
            }
            case "file" -> {
                if (!Files.isRegularFile(absolute)) {
                    throw new BundleException("Context source file not found: " + source.path());
                }
                return List.of(absolute);
            }
            default -> throw new BundleException(
                "Unsupported context source type '" + source.type() + "' for path '" + source.path() + "'."
            );
        }
    }

    private static String relativize(Path root, Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new BundleException("Context source " + normalized + " lies outside the workspace " + root);
        }
        List<String> parts = new ArrayList<>();
        for (Path part : root.relativize(normalized)) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
