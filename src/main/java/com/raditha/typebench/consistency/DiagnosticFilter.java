package com.raditha.typebench.consistency;

import com.raditha.typebench.config.CheckerConfig;
import com.raditha.typebench.model.Diagnostic;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Selects the diagnostics that count toward the consistency score.
 * <p>
 * A diagnostic counts when it is an error located inside the checked tree and
 * either carries one of the kept codes or mentions the keyword (by default
 * {@code incompatible}). Errors in installed libraries or stubs outside the
 * tree never count.
 */
public class DiagnosticFilter {

    private final Set<String> keepCodes;
    private final String keyword;

    public DiagnosticFilter(CheckerConfig config) {
        this(config.keepCodes(), config.keyword());
    }

    public DiagnosticFilter(Set<String> keepCodes, String keyword) {
        this.keepCodes = Set.copyOf(keepCodes);
        this.keyword = keyword;
    }

    public List<Diagnostic> filter(List<Diagnostic> diagnostics, Path variantRoot) {
        Path root = variantRoot.toAbsolutePath().normalize();
        return diagnostics.stream()
                .filter(Diagnostic::isError)
                .filter(this::isRelevant)
                .filter(d -> isInside(d.file(), root))
                .toList();
    }

    public int count(List<Diagnostic> diagnostics, Path variantRoot) {
        return filter(diagnostics, variantRoot).size();
    }

    private boolean isRelevant(Diagnostic diagnostic) {
        if (keepCodes.contains(diagnostic.code())) {
            return true;
        }
        return !keyword.isEmpty() && diagnostic.message().contains(keyword);
    }

    private static boolean isInside(String file, Path root) {
        try {
            Path path = Path.of(file);
            Path resolved = (path.isAbsolute() ? path : root.resolve(path)).normalize();
            return resolved.startsWith(root);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
