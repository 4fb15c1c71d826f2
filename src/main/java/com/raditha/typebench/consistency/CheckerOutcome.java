package com.raditha.typebench.consistency;

import com.raditha.typebench.model.Diagnostic;
import com.raditha.typebench.model.MetricValue;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of checking one variant.
 *
 * @param available     whether the checker completed
 * @param diagnostics   every parsed diagnostic, paths relative to the variant root
 * @param filteredCount number of diagnostics that count toward consistency
 * @param reason        why the checker was unavailable, {@code null} when available
 */
public record CheckerOutcome(
        boolean available,
        List<Diagnostic> diagnostics,
        int filteredCount,
        @Nullable String reason) {

    public CheckerOutcome {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        if (filteredCount < 0) {
            throw new IllegalArgumentException("filteredCount must be >= 0");
        }
    }

    public static CheckerOutcome completed(List<Diagnostic> diagnostics, int filteredCount) {
        return new CheckerOutcome(true, diagnostics, filteredCount, null);
    }

    public static CheckerOutcome unavailable(String reason) {
        return new CheckerOutcome(false, List.of(), 0, reason);
    }

    /**
     * The consistency figure for the tabular output: the filtered count, or {@code unavailable}.
     */
    public MetricValue consistency() {
        return available ? MetricValue.count(filteredCount) : MetricValue.unavailable();
    }
}
