package org.caureq.fleethub.storage.archive;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Naming and retention arithmetic for the monthly raw tables ({@code metrics_history_YYYY_MM}, UTC).
 */
public final class MonthlyPartitions {
    public static final String PREFIX = "metrics_history_";
    private static final Pattern NAME = Pattern.compile("^metrics_history_(\\d{4})_(\\d{2})$");

    private MonthlyPartitions() {}

    public static String partitionName(int year, int month) {
        return String.format(Locale.ROOT, "%s%04d_%02d", PREFIX, year, month);
    }

    public static String partitionName(YearMonth ym) {
        return partitionName(ym.getYear(), ym.getMonthValue());
    }

    public static String partitionFor(Instant t) {
        return partitionName(monthOf(t));
    }

    public static YearMonth monthOf(Instant t) {
        return YearMonth.from(t.atOffset(ZoneOffset.UTC));
    }

    /** Month encoded in a table name, if it is one of ours. Case-insensitive. */
    public static Optional<YearMonth> parse(String tableName) {
        if (tableName == null) return Optional.empty();
        var m = NAME.matcher(tableName.toLowerCase(Locale.ROOT));
        if (!m.matches()) return Optional.empty();
        int month = Integer.parseInt(m.group(2));
        if (month < 1 || month > 12) return Optional.empty();
        return Optional.of(YearMonth.of(Integer.parseInt(m.group(1)), month));
    }

    /** Every partition name whose month overlaps [start, end]. */
    public static List<String> between(Instant start, Instant end) {
        List<String> out = new ArrayList<>();
        var cur = monthOf(start);
        var last = monthOf(end);
        while (!cur.isAfter(last)) {
            out.add(partitionName(cur));
            cur = cur.plusMonths(1);
        }
        return out;
    }

    /** First month that must be kept: start-of-month of {@code now - retentionDays}. */
    public static YearMonth retentionCutoff(Instant now, int retentionDays) {
        return monthOf(now.minus(Duration.ofDays(retentionDays)));
    }

    public static boolean expired(YearMonth partitionMonth, YearMonth cutoff) {
        return partitionMonth.isBefore(cutoff);
    }
}
