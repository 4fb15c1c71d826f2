package com.raditha.typebench.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the Python modules of a repository tree.
 * <p>
 * When the tree keeps its code under {@code src/} or {@code lib/}, scanning
 * starts there so module names do not carry the layout directory.
 */
public class SourceTreeScanner {

    private static final Logger logger = LoggerFactory.getLogger(SourceTreeScanner.class);

    private static final String INIT_MODULE = "__init__";

    /**
     * Resolve the directory that module names are relative to.
     */
    public Path sourceRoot(Path repoRoot) {
        Path effective = repoRoot;
        if (Files.isDirectory(effective.resolve("src"))) {
            effective = effective.resolve("src");
        }
        if (Files.isDirectory(effective.resolve("lib"))) {
            effective = effective.resolve("lib");
        }
        return effective;
    }

    /**
     * List the Python source files of a repository, sorted by relative path.
     *
     * @param repoRoot repository root
     * @return source files with their module names
     * @throws IOException if the root is missing or cannot be walked
     */
    public List<SourceFile> scan(Path repoRoot) throws IOException {
        if (!Files.isDirectory(repoRoot)) {
            throw new IOException("Not a directory: " + repoRoot);
        }
        Path root = sourceRoot(repoRoot);

        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root)) {
            candidates = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> isPythonFile(p.getFileName().toString()))
                    .filter(p -> !isHidden(root.relativize(p)))
                    .sorted(Comparator.comparing(p -> relative(root, p)))
                    .toList();
        }

        Set<String> seen = new HashSet<>();
        for (Path p : candidates) {
            seen.add(relative(root, p));
        }

        List<SourceFile> files = new ArrayList<>();
        for (Path p : candidates) {
            String rel = relative(root, p);
            if (isShadowed(rel, seen)) {
                logger.debug("Skipping {} in favour of its package or implementation file", rel);
                continue;
            }
            String module = moduleName(rel);
            if (module.isEmpty() || module.startsWith(".")) {
                continue;
            }
            files.add(new SourceFile(p, rel, module));
        }
        logger.debug("Found {} Python modules under {}", files.size(), root);
        return files;
    }

    /**
     * Dotted module name for a relative path.
     * {@code pkg/sub/__init__.py} becomes {@code pkg.sub}, {@code pkg/mod.pyi} becomes {@code pkg.mod}.
     */
    static String moduleName(String relativePath) {
        String withoutExtension = relativePath.substring(0, relativePath.lastIndexOf('.'));
        String[] parts = withoutExtension.split("/");
        StringBuilder module = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i == parts.length - 1 && INIT_MODULE.equals(parts[i])) {
                break;
            }
            if (module.length() > 0) {
                module.append('.');
            }
            module.append(parts[i]);
        }
        return module.toString();
    }

    private static boolean isShadowed(String rel, Set<String> seen) {
        String stem = rel.substring(0, rel.lastIndexOf('.'));
        if (rel.endsWith(".pyi") && seen.contains(stem + ".py")) {
            return true;
        }
        if (stem.endsWith("/" + INIT_MODULE) || stem.equals(INIT_MODULE)) {
            return false;
        }
        return seen.contains(stem + "/" + INIT_MODULE + ".py") || seen.contains(stem + "/" + INIT_MODULE + ".pyi");
    }

    private static boolean isPythonFile(String fileName) {
        return fileName.endsWith(".py") || fileName.endsWith(".pyi");
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
