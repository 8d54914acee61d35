package com.gridbot.cli.tools;

import com.gridbot.domain.market.Candle;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads candles for backtests from CSV. An optional header line is skipped.
 *
 * <p>Accepted column layouts:
 * <ul>
 *   <li>{@code time,close}</li>
 *   <li>{@code time,open,high,low,close[,volume]}</li>
 *   <li>{@code openTime,open,high,low,close,volume,closeTime[,...]} (exchange kline dumps)</li>
 * </ul>
 * Times are epoch millis; values below 1e11 are read as epoch seconds.
 */
public final class CandleCsv {

    private static final long SECONDS_THRESHOLD = 100_000_000_000L;

    private CandleCsv() {
    }

    public static List<Candle> read(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    public static List<Candle> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<Candle> candles = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            String[] cols = t.split("[,;]");
            if (candles.isEmpty() && !isNumber(cols[0])) {
                // header
                continue;
            }
            try {
                candles.add(parse(cols));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        return candles;
    }

    static Candle parse(String[] cols) {
        long time = millis(cols[0]);
        if (cols.length == 2) {
            double close = num(cols[1]);
            return new Candle(time, close, close, close, close, 0.0, time);
        }
        if (cols.length == 5 || cols.length == 6) {
            double volume = cols.length == 6 ? num(cols[5]) : 0.0;
            return new Candle(time, num(cols[1]), num(cols[2]), num(cols[3]), num(cols[4]), volume, time);
        }
        if (cols.length >= 7) {
            return new Candle(time, num(cols[1]), num(cols[2]), num(cols[3]), num(cols[4]), num(cols[5]),
                    millis(cols[6]));
        }
        throw new IllegalArgumentException("expected 2, 5, 6 or 7+ columns, got " + cols.length);
    }

    private static long millis(String s) {
        long v = (long) num(s);
        return v < SECONDS_THRESHOLD ? v * 1000 : v;
    }

    private static double num(String s) {
        String t = s.trim();
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) t = t.substring(1, t.length() - 1);
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: '" + s + "'", e);
        }
    }

    private static boolean isNumber(String s) {
        try {
            num(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
