package com.freightoptimization.tracking.model;

import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A calendar-month slice of the position history, covering {@code [rangeStart, rangeEnd)} in UTC.
 */
@Value
public class MonthlyPartition implements Comparable<MonthlyPartition> {

    public static final String NAME_PREFIX = "position_history_";
    private static final Pattern NAME_PATTERN = Pattern.compile("^" + NAME_PREFIX + "y(\\d{4})m(\\d{2})$");

    YearMonth month;

    public static MonthlyPartition of(YearMonth month) {
        return new MonthlyPartition(month);
    }

    public static MonthlyPartition containing(Instant instant) {
        return new MonthlyPartition(YearMonth.from(instant.atZone(ZoneOffset.UTC)));
    }

    public static Optional<MonthlyPartition> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Matcher matcher = NAME_PATTERN.matcher(name);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int month = Integer.parseInt(matcher.group(2));
        if (month < 1 || month > 12) {
            return Optional.empty();
        }
        return Optional.of(new MonthlyPartition(YearMonth.of(Integer.parseInt(matcher.group(1)), month)));
    }

    /**
     * Start of the oldest month still inside the retention window: partitions ending at or before
     * this instant are eligible for pruning.
     */
    public static Instant retentionCutoff(Instant now, int retentionMonths) {
        if (retentionMonths < 0) {
            throw new IllegalArgumentException("retentionMonths must be >= 0");
        }
        return containing(now).getMonth().minusMonths(retentionMonths)
                .atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public String getName() {
        return String.format("%sy%04dm%02d", NAME_PREFIX, month.getYear(), month.getMonthValue());
    }

    public Instant getRangeStart() {
        return month.atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public Instant getRangeEnd() {
        return month.plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(getRangeStart()) && instant.isBefore(getRangeEnd());
    }

    /** True when any part of {@code [start, end]} falls inside this partition. */
    public boolean overlaps(Instant start, Instant end) {
        return !end.isBefore(getRangeStart()) && start.isBefore(getRangeEnd());
    }

    public MonthlyPartition next() {
        return new MonthlyPartition(month.plusMonths(1));
    }

    @Override
    public int compareTo(MonthlyPartition other) {
        return month.compareTo(other.month);
    }

    @Override
    public String toString() {
        return getName() + " [" + getRangeStart() + ", " + getRangeEnd() + ")";
    }
}
