package com.raditha.typebench.extraction;

import java.nio.file.Path;

/**
 * A Python source file found under a scanned root.
 *
 * @param path         absolute location on disk
 * @param relativePath path relative to the scanned root, with forward slashes
 * @param module       dotted module name ({@code pkg/__init__.py} is {@code pkg})
 */
public record SourceFile(Path path, String relativePath, String module) {
}
