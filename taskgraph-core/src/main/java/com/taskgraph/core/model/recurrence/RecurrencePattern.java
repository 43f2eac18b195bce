package com.taskgraph.core.model.recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

/**
 * When a recurring task repeats.
 *
 * Invariants (checked by the recurrence calculator):
 * - interval in [1, 100]
 * - WEEKLY needs at least one week day
 * - MONTHLY/DATE needs monthDay; MONTHLY/DAY needs monthWeek and monthWeekday
 * - YEARLY needs yearlyMonth and yearlyDay
 * - EndType.DATE needs endDate; EndType.COUNT needs endCount >= 1
 */
public record RecurrencePattern(
    String id,
    Frequency frequency,
    int interval,

    // Daily
    boolean businessDaysOnly,

    // Weekly
    Set<DayOfWeek> weekDays,

    // Monthly
    MonthlyType monthlyType,
    Integer monthDay,
    Integer monthWeek,
    DayOfWeek monthWeekday,

    // Yearly
    Integer yearlyMonth,
    Integer yearlyDay,

    // End
    EndType endType,
    LocalDate endDate,
    Integer endCount,

    // Exclusions
    boolean excludeHolidays,
    Set<LocalDate> excludedDates,

    // Timing
    LocalTime preferredTime,
    ZoneId timezone
) {
    public static final int MIN_INTERVAL = 1;
    public static final int MAX_INTERVAL = 100;

    public RecurrencePattern {
        weekDays = weekDays == null ? Set.of() : Set.copyOf(weekDays);
        excludedDates = excludedDates == null ? Set.of() : Set.copyOf(excludedDates);
        endType = endType == null ? EndType.NEVER : endType;
        monthlyType = monthlyType == null ? MonthlyType.DATE : monthlyType;
    }

    /**
     * Time of day of every occurrence; midnight when no preference is set.
     */
    public LocalTime occurrenceTime() {
        return preferredTime == null ? LocalTime.MIDNIGHT : preferredTime;
    }

    public ZoneId zone() {
        return timezone == null ? ZoneOffset.UTC : timezone;
    }

    public static Builder builder(Frequency frequency) {
        return new Builder(frequency);
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private final Frequency frequency;
        private int interval = 1;
        private boolean businessDaysOnly;
        private Set<DayOfWeek> weekDays = Set.of();
        private MonthlyType monthlyType = MonthlyType.DATE;
        private Integer monthDay;
        private Integer monthWeek;
        private DayOfWeek monthWeekday;
        private Integer yearlyMonth;
        private Integer yearlyDay;
        private EndType endType = EndType.NEVER;
        private LocalDate endDate;
        private Integer endCount;
        private boolean excludeHolidays;
        private Set<LocalDate> excludedDates = Set.of();
        private LocalTime preferredTime;
        private ZoneId timezone;

        private Builder(Frequency frequency) {
            this.frequency = frequency;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder interval(int interval) {
            this.interval = interval;
            return this;
        }

        public Builder businessDaysOnly(boolean businessDaysOnly) {
            this.businessDaysOnly = businessDaysOnly;
            return this;
        }

        public Builder weekDays(Set<DayOfWeek> weekDays) {
            this.weekDays = weekDays;
            return this;
        }

        public Builder monthDay(int monthDay) {
            this.monthlyType = MonthlyType.DATE;
            this.monthDay = monthDay;
            return this;
        }

        public Builder nthWeekday(int monthWeek, DayOfWeek monthWeekday) {
            this.monthlyType = MonthlyType.DAY;
            this.monthWeek = monthWeek;
            this.monthWeekday = monthWeekday;
            return this;
        }

        public Builder yearly(int month, int day) {
            this.yearlyMonth = month;
            this.yearlyDay = day;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endType = EndType.DATE;
            this.endDate = endDate;
            return this;
        }

        public Builder endCount(int endCount) {
            this.endType = EndType.COUNT;
            this.endCount = endCount;
            return this;
        }

        public Builder excludeHolidays(boolean excludeHolidays) {
            this.excludeHolidays = excludeHolidays;
            return this;
        }

        public Builder excludedDates(Set<LocalDate> excludedDates) {
            this.excludedDates = excludedDates;
            return this;
        }

        public Builder preferredTime(LocalTime preferredTime) {
            this.preferredTime = preferredTime;
            return this;
        }

        public Builder timezone(ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public RecurrencePattern build() {
            return new RecurrencePattern(
                id, frequency, interval, businessDaysOnly, weekDays,
                monthlyType, monthDay, monthWeek, monthWeekday,
                yearlyMonth, yearlyDay, endType, endDate, endCount,
                excludeHolidays, excludedDates, preferredTime, timezone
            );
        }
    }
}
