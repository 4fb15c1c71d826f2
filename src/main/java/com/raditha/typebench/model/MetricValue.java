package com.raditha.typebench.model;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A reported statistic: either a number or an explicit sentinel.
 * Missing data is never folded into zero; empty buckets are {@code N/A} and
 * checker failures are {@code unavailable}.
 */
public final class MetricValue {

    public static final String NOT_APPLICABLE_TEXT = "N/A";
    public static final String UNAVAILABLE_TEXT = "unavailable";

    private static final MetricValue NOT_APPLICABLE = new MetricValue(Double.NaN, NOT_APPLICABLE_TEXT, false);
    private static final MetricValue UNAVAILABLE = new MetricValue(Double.NaN, UNAVAILABLE_TEXT, false);

    private final double value;
    private final @Nullable String sentinel;
    private final boolean integral;

    private MetricValue(double value, @Nullable String sentinel, boolean integral) {
        this.value = value;
        this.sentinel = sentinel;
        this.integral = integral;
    }

    public static MetricValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Metric must be finite, got " + value);
        }
        return new MetricValue(value, null, false);
    }

    public static MetricValue count(long count) {
        return new MetricValue(count, null, true);
    }

    public static MetricValue notApplicable() {
        return NOT_APPLICABLE;
    }

    public static MetricValue unavailable() {
        return UNAVAILABLE;
    }

    /**
     * Mean of {@code sum} over {@code n} items, {@code N/A} when {@code n} is zero.
     */
    public static MetricValue ratio(double sum, long n) {
        return n == 0 ? NOT_APPLICABLE : of(sum / n);
    }

    /**
     * Parse the textual form written by {@link #format()}.
     */
    public static MetricValue parse(String text) {
        String trimmed = text.trim();
        if (NOT_APPLICABLE_TEXT.equals(trimmed) || trimmed.isEmpty()) {
            return NOT_APPLICABLE;
        }
        if (UNAVAILABLE_TEXT.equals(trimmed)) {
            return UNAVAILABLE;
        }
        if (trimmed.matches("-?\\d+")) {
            return count(Long.parseLong(trimmed));
        }
        return of(Double.parseDouble(trimmed));
    }

    public boolean isPresent() {
        return sentinel == null;
    }

    public boolean isNotApplicable() {
        return this == NOT_APPLICABLE;
    }

    public boolean isUnavailable() {
        return this == UNAVAILABLE;
    }

    /**
     * True for counts, which are written without decimals.
     */
    public boolean isIntegral() {
        return isPresent() && integral;
    }

    public OptionalDouble value() {
        return isPresent() ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * The number, for callers that have already checked {@link #isPresent()}.
     *
     * @throws IllegalStateException on a sentinel
     */
    public double asDouble() {
        if (!isPresent()) {
            throw new IllegalStateException("No numeric value: " + sentinel);
        }
        return value;
    }

    /**
     * Tabular form: counts as integers, scores with four decimals, sentinels verbatim.
     */
    public String format() {
        if (!isPresent()) {
            return sentinel;
        }
        if (integral) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricValue that)) return false;
        if (!isPresent() || !that.isPresent()) {
            return Objects.equals(sentinel, that.sentinel);
        }
        return Double.compare(value, that.value) == 0 && integral == that.integral;
    }

    @Override
    public int hashCode() {
        return isPresent() ? Double.hashCode(value) : sentinel.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
