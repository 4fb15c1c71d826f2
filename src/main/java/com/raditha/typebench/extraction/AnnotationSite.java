package com.raditha.typebench.extraction;

/**
 * Where an annotation was written.
 *
 * @param file       repo-relative path with forward slashes
 * @param line       1-based line of the declaring statement
 * @param annotation annotation text exactly as written (trimmed)
 */
public record AnnotationSite(String file, int line, String annotation) {
}
