package com.raditha.typebench.consistency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * A private temporary copy of a source tree. Checkers may write caches and
 * byte code into it without disturbing the original or another worker.
 * Closing the workspace deletes the copy.
 */
public final class VariantWorkspace implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VariantWorkspace.class);

    private final Path root;

    private VariantWorkspace(Path root) {
        this.root = root;
    }

    /**
     * Copy a tree into a fresh temporary directory.
     *
     * @param source tree to copy
     * @param label  readable part of the temporary directory name
     */
    public static VariantWorkspace copyOf(Path source, String label) throws IOException {
        if (!Files.isDirectory(source)) {
            throw new IOException("Not a directory: " + source);
        }
        Path target = Files.createTempDirectory("typebench-" + label.replaceAll("[^A-Za-z0-9_.-]", "_") + "-")
                .toRealPath();
        try {
            copyTree(source, target);
        } catch (IOException e) {
            deleteTree(target);
            throw e;
        }
        return new VariantWorkspace(target);
    }

    public Path root() {
        return root;
    }

    @Override
    public void close() {
        try {
            deleteTree(root);
        } catch (IOException e) {
            logger.warn("Could not delete workspace {}: {}", root, e.getMessage());
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && dir.getFileName().toString().equals(".git")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
