package com.raditha.typebench.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Content hash of a prediction tree, used as the cache key.
 * <p>
 * Covers the relative path and bytes of every Python file in the tree plus a
 * fingerprint of the settings that shape cached results, so changing either
 * the predictions or those settings yields a new key.
 */
public class PredictionHasher {

    private final String settingsFingerprint;

    /**
     * @param settingsFingerprint stable text describing the scoring and checker settings
     */
    public PredictionHasher(String settingsFingerprint) {
        this.settingsFingerprint = settingsFingerprint;
    }

    /**
     * SHA-256 of the tree, hex encoded.
     *
     * @throws IOException if the tree cannot be walked or a file cannot be read
     */
    public String hash(Path predictionTree) throws IOException {
        if (!Files.isDirectory(predictionTree)) {
            throw new IOException("Not a directory: " + predictionTree);
        }
        MessageDigest digest = sha256();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(predictionTree)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".py") || name.endsWith(".pyi");
                    })
                    .filter(p -> !isHidden(predictionTree.relativize(p)))
                    .sorted((a, b) -> relative(predictionTree, a).compareTo(relative(predictionTree, b)))
                    .toList();
        }
        for (Path file : files) {
            digest.update(relative(predictionTree, file).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(Files.readAllBytes(file));
            digest.update((byte) 0);
        }
        digest.update(settingsFingerprint.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
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
