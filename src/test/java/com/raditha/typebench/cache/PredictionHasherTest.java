package com.raditha.typebench.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PredictionHasherTest {

    @TempDir
    Path tempDir;

    private Path tree(String name) throws IOException {
        Path root = tempDir.resolve(name);
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/a.py"), "x: int = 1\n");
        Files.writeString(root.resolve("pkg/b.pyi"), "def f() -> str: ...\n");
        return root;
    }

    @Test
    void testSameContentSameHash() throws IOException {
        PredictionHasher hasher = new PredictionHasher("settings");
        String first = hasher.hash(tree("one"));

        assertEquals(64, first.length());
        assertTrue(first.matches("[0-9a-f]+"));
        assertEquals(first, hasher.hash(tree("two")), "location of the tree does not matter");
    }

    @Test
    void testIgnoresNonPythonAndHiddenFiles() throws IOException {
        PredictionHasher hasher = new PredictionHasher("settings");
        Path root = tree("one");
        String before = hasher.hash(root);

        Files.writeString(root.resolve("README.md"), "docs");
        Files.createDirectories(root.resolve(".mypy_cache"));
        Files.writeString(root.resolve(".mypy_cache/x.py"), "junk");

        assertEquals(before, hasher.hash(root));
    }

    @Test
    void testContentPathAndSettingsChangeTheHash() throws IOException {
        PredictionHasher hasher = new PredictionHasher("settings");
        Path root = tree("one");
        String original = hasher.hash(root);

        assertNotEquals(original, new PredictionHasher("other settings").hash(root));

        Files.writeString(root.resolve("pkg/a.py"), "x: str = 1\n");
        String edited = hasher.hash(root);
        assertNotEquals(original, edited);

        Files.move(root.resolve("pkg/a.py"), root.resolve("pkg/c.py"));
        assertNotEquals(edited, hasher.hash(root));
    }

    @Test
    void testMissingTree() {
        assertThrows(IOException.class, () -> new PredictionHasher("").hash(tempDir.resolve("absent")));
    }
}
