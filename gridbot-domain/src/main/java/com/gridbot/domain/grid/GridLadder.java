package com.gridbot.domain.grid;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Maps prices onto grid bands.
 *
 * <p>Band {@code i} is the half-open interval {@code [line[i], line[i+1])}. A price below the lowest
 * line is band {@code -1}; a price at or above the top line is band {@link #aboveGridBand}. A price
 * exactly on a line belongs to the higher band.
 *
 * <p>Stateless; safe to call from any number of threads.
 */
public final class GridLadder {

    public static final int BELOW_GRID = -1;

    private GridLadder() {}

    public static int bandOf(BigDecimal price, GridConfig config) {
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(config, "config");

        List<BigDecimal> lines = config.lines();
        // number of lines <= price, minus one
        int lo = 0;
        int hi = lines.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (lines.get(mid).compareTo(price) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    /** Band index assigned to prices at or above the top line. */
    public static int aboveGridBand(GridConfig config) {
        return config.lineCount() - 1;
    }

    /** Number of bands between lines, excluding the below-grid and above-grid ones. */
    public static int bandCount(GridConfig config) {
        return config.lineCount() - 1;
    }

    /** Lower boundary price of band {@code band}; valid for {@code 0 <= band < lineCount}. */
    public static BigDecimal linePrice(int band, GridConfig config) {
        List<BigDecimal> lines = config.lines();
        if (band < 0 || band >= lines.size()) {
            throw new IndexOutOfBoundsException("No grid line for band " + band);
        }
        return lines.get(band);
    }
}
