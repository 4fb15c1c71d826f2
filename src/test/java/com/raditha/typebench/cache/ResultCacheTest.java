package com.raditha.typebench.cache;

import com.raditha.typebench.consistency.CheckerOutcome;
import com.raditha.typebench.model.Diagnostic;
import com.raditha.typebench.model.ScoreRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    @TempDir
    Path cacheDir;

    private ResultCache cache;

    @BeforeEach
    void setUp() {
        cache = new ResultCache(cacheDir);
    }

    private static CacheEntry entry(String repo, String hash, CheckerOutcome prediction) {
        List<ScoreRecord> records = List.of(
                new ScoreRecord("pkg.a.x", 0.875, 0, 3, "dict[str, list[int]]", "dict[str, list[str]]", false),
                new ScoreRecord("pkg.a.f::return", 0.0, 0, 1, "str", null, true));
        CheckerOutcome truth = CheckerOutcome.completed(
                List.of(new Diagnostic("pkg/a.py", 3, 0, "error", "Incompatible types", "assignment")), 1);
        return new CacheEntry(repo, hash, Instant.parse("2026-10-01T12:00:00Z"), records, truth, prediction);
    }

    @Test
    void testWriteThenRead() throws IOException {
        CacheEntry written = entry("demo", "abc123", CheckerOutcome.completed(List.of(), 0));
        cache.write(written);

        assertTrue(Files.isRegularFile(cacheDir.resolve("demo/abc123.json")));
        Optional<CacheEntry> read = cache.lookup("demo", "abc123");

        assertTrue(read.isPresent());
        assertEquals(written, read.get());
        assertNull(read.get().records().get(1).predictedLabel());
        try (var files = Files.list(cacheDir.resolve("demo"))) {
            assertEquals(1, files.count(), "no temporary files are left behind");
        }
    }

    @Test
    void testMissingKey() {
        assertTrue(cache.read("demo", "nothing").isEmpty());
    }

    @Test
    void testUnavailableEntriesAreStoredButNotReused() throws IOException {
        cache.write(entry("demo", "h1", CheckerOutcome.unavailable("timed out after 600s")));

        assertTrue(cache.read("demo", "h1").isPresent());
        assertEquals("timed out after 600s", cache.read("demo", "h1").get().predictionOutcome().reason());
        assertTrue(cache.lookup("demo", "h1").isEmpty());
    }

    @Test
    void testCorruptEntryIsIgnored() throws IOException {
        Files.createDirectories(cacheDir.resolve("demo"));
        Files.writeString(cacheDir.resolve("demo/h2.json"), "{ \"repo\": \"demo\", ");

        assertTrue(cache.read("demo", "h2").isEmpty());
    }

    @Test
    void testEntryUnderTheWrongKeyIsIgnored() throws IOException {
        cache.write(entry("demo", "h3", CheckerOutcome.completed(List.of(), 0)));
        Files.createDirectories(cacheDir.resolve("other"));
        Files.copy(cacheDir.resolve("demo/h3.json"), cacheDir.resolve("other/h3.json"));

        assertTrue(cache.read("other", "h3").isEmpty());
    }

    @Test
    void testRewriteReplacesEntry() throws IOException {
        cache.write(entry("demo", "h4", CheckerOutcome.unavailable("crashed")));
        cache.write(entry("demo", "h4", CheckerOutcome.completed(List.of(), 2)));

        assertEquals(2, cache.lookup("demo", "h4").orElseThrow().predictionOutcome().filteredCount());
    }
}
