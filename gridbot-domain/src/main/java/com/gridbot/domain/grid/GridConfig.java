package com.gridbot.domain.grid;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable grid definition: price bounds, the price lines derived from them and the quote notional
 * spent per line.
 *
 * <p>Lines are computed once at construction and never change for the lifetime of the instance.
 * Two construction modes are supported:
 * <ul>
 *   <li>{@link #ofLineCount} - {@code lineCount} evenly spaced lines including both bounds</li>
 *   <li>{@link #ofSpacing} - lines {@code lower, lower + spacing, ...} not exceeding {@code upper}</li>
 * </ul>
 */
public final class GridConfig {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final BigDecimal lower;
    private final BigDecimal upper;
    private final BigDecimal orderNotional;
    private final List<BigDecimal> lines;

    private GridConfig(BigDecimal lower, BigDecimal upper, BigDecimal orderNotional, List<BigDecimal> lines) {
        this.lower = lower;
        this.upper = upper;
        this.orderNotional = orderNotional;
        this.lines = Collections.unmodifiableList(lines);
    }

    public static GridConfig ofLineCount(BigDecimal lower, BigDecimal upper, int lineCount, BigDecimal orderNotional) {
        validateBounds(lower, upper, orderNotional);
        if (lineCount < 2) {
            throw new IllegalArgumentException("lineCount must be >= 2, got " + lineCount);
        }

        List<BigDecimal> out = new ArrayList<>(lineCount);
        BigDecimal width = upper.subtract(lower);
        BigDecimal intervals = BigDecimal.valueOf(lineCount - 1L);
        for (int i = 0; i < lineCount - 1; i++) {
            BigDecimal offset = width.multiply(BigDecimal.valueOf(i)).divide(intervals, MC);
            out.add(lower.add(offset));
        }
        out.add(upper);
        return new GridConfig(lower, upper, orderNotional, out);
    }

    public static GridConfig ofSpacing(BigDecimal lower, BigDecimal upper, BigDecimal spacing, BigDecimal orderNotional) {
        validateBounds(lower, upper, orderNotional);
        Objects.requireNonNull(spacing, "spacing");
        if (spacing.signum() <= 0) {
            throw new IllegalArgumentException("spacing must be > 0, got " + spacing);
        }

        List<BigDecimal> out = new ArrayList<>();
        for (BigDecimal line = lower; line.compareTo(upper) <= 0; line = line.add(spacing)) {
            out.add(line);
        }
        if (out.size() < 2) {
            throw new IllegalArgumentException("spacing " + spacing + " leaves fewer than 2 lines in [" + lower + ", " + upper + "]");
        }
        return new GridConfig(lower, upper, orderNotional, out);
    }

    /**
     * Classical center/step grid: {@code levelsDown} lines below and {@code levelsUp} lines above
     * {@code center}, spaced {@code stepPct} percent of the center price apart.
     */
    public static GridConfig fromCenter(BigDecimal center, BigDecimal stepPct, int levelsDown, int levelsUp, BigDecimal orderNotional) {
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(stepPct, "stepPct");
        if (levelsDown < 0 || levelsUp < 0 || levelsDown + levelsUp < 1) {
            throw new IllegalArgumentException("levelsDown/levelsUp must be >= 0 and span at least one band");
        }
        BigDecimal step = center.multiply(stepPct).divide(BigDecimal.valueOf(100), MC);
        BigDecimal lower = center.subtract(step.multiply(BigDecimal.valueOf(levelsDown)));
        BigDecimal upper = center.add(step.multiply(BigDecimal.valueOf(levelsUp)));
        return ofSpacing(lower, upper, step, orderNotional);
    }

    private static void validateBounds(BigDecimal lower, BigDecimal upper, BigDecimal orderNotional) {
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        Objects.requireNonNull(orderNotional, "orderNotional");
        if (lower.signum() <= 0) {
            throw new IllegalArgumentException("lower must be > 0, got " + lower);
        }
        if (lower.compareTo(upper) >= 0) {
            throw new IllegalArgumentException("lower must be < upper, got " + lower + " >= " + upper);
        }
        if (orderNotional.signum() <= 0) {
            throw new IllegalArgumentException("orderNotional must be > 0, got " + orderNotional);
        }
    }

    public BigDecimal lower() { return lower; }

    public BigDecimal upper() { return upper; }

    public BigDecimal orderNotional() { return orderNotional; }

    /** Strictly increasing grid lines. */
    public List<BigDecimal> lines() { return lines; }

    public int lineCount() { return lines.size(); }

    @Override
    public String toString() {
        return "GridConfig{lower=" + lower + ", upper=" + upper + ", lines=" + lines.size()
                + ", orderNotional=" + orderNotional + "}";
    }
}
