package com.raditha.typebench.cache;

import com.raditha.typebench.consistency.CheckerOutcome;
import com.raditha.typebench.model.ScoreRecord;

import java.time.Instant;
import java.util.List;

/**
 * Everything computed for one repository and one prediction hash.
 * Entries are replaced wholesale, never updated in place.
 *
 * @param repo              repository name
 * @param hash              prediction hash the entry was computed for
 * @param createdAt         when the entry was computed
 * @param records           per-variable scores
 * @param truthOutcome      checker outcome of the ground-truth variant
 * @param predictionOutcome checker outcome of the prediction variant
 */
public record CacheEntry(
        String repo,
        String hash,
        Instant createdAt,
        List<ScoreRecord> records,
        CheckerOutcome truthOutcome,
        CheckerOutcome predictionOutcome) {

    public CacheEntry {
        records = records == null ? List.of() : List.copyOf(records);
    }

    /**
     * An entry can stand in for a fresh evaluation only when both checker runs completed.
     * Entries with an unavailable outcome are kept for audit and recomputed next time.
     */
    public boolean reusable() {
        return truthOutcome.available() && predictionOutcome.available();
    }
}
