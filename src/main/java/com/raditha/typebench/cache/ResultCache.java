package com.raditha.typebench.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Content-addressed store of evaluation results at {@code <root>/<repo>/<hash>.json}.
 * <p>
 * Workers touch disjoint keys, and a write goes to a temporary file that is
 * then moved over the target, so readers never see a partial entry. Entries
 * that cannot be read are treated as absent.
 */
public class ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path root;

    public ResultCache(Path root) {
        this.root = root;
    }

    public Path entryPath(String repo, String hash) {
        return root.resolve(repo).resolve(hash + ".json");
    }

    /**
     * Read the entry for a key.
     *
     * @return the stored entry, or empty if absent or unreadable
     */
    public Optional<CacheEntry> read(String repo, String hash) {
        Path path = entryPath(repo, hash);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = mapper.readValue(path.toFile(), CacheEntry.class);
            if (!repo.equals(entry.repo()) || !hash.equals(entry.hash())) {
                logger.warn("Ignoring cache entry {}: it belongs to {}/{}", path, entry.repo(), entry.hash());
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable cache entry {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * An entry that may replace a fresh evaluation.
     */
    public Optional<CacheEntry> lookup(String repo, String hash) {
        Optional<CacheEntry> entry = read(repo, hash);
        if (entry.isPresent() && !entry.get().reusable()) {
            logger.info("Cached result for {} has an unavailable checker outcome; recomputing", repo);
            return Optional.empty();
        }
        return entry;
    }

    /**
     * Store an entry, replacing any previous one for the same key.
     */
    public void write(CacheEntry entry) throws IOException {
        Path target = entryPath(entry.repo(), entry.hash());
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), entry.hash(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entry);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Cached {} records for {} under {}", entry.records().size(), entry.repo(), target);
    }
}
