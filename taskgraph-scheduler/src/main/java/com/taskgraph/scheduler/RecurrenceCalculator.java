package com.taskgraph.scheduler;

import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.recurrence.EndType;
import com.taskgraph.core.model.recurrence.MonthlyType;
import com.taskgraph.core.model.recurrence.RecurrencePattern;
import com.taskgraph.core.model.recurrence.RecurrencePreview;
import com.taskgraph.core.model.recurrence.RecurrencePreview.Occurrence;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.time.Period;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Turns a recurrence pattern into concrete occurrences.
 *
 * Occurrences fall on the pattern's preferred time (midnight by default) in the pattern's zone.
 * Intervals are counted from an anchor date: days for daily patterns, Monday-based weeks for
 * weekly ones, calendar months and years for the others. Stateless and thread-safe.
 */
public class RecurrenceCalculator {

    /**
     * No occurrence is ever searched for further than this past the reference instant.
     */
    public static final Period SAFETY_HORIZON = Period.ofYears(5);

    public static final int MAX_PREVIEW_COUNT = 100;

    private final HolidayCalendar holidays;

    public RecurrenceCalculator() {
        this(HolidayCalendar.standard());
    }

    public RecurrenceCalculator(HolidayCalendar holidays) {
        this.holidays = holidays;
    }

    // ========== Next Occurrence ==========

    /**
     * First occurrence strictly after an instant, anchored at that instant's date.
     */
    public Optional<ZonedDateTime> nextOccurrence(RecurrencePattern pattern, Instant after) {
        return nextOccurrence(pattern, after, after.atZone(pattern.zone()).toLocalDate(), 0);
    }

    /**
     * First occurrence strictly after an instant.
     *
     * @param pattern The recurrence pattern
     * @param after Occurrences at or before this instant are ignored
     * @param anchor Date the interval is counted from
     * @param occurrencesSoFar Occurrences already produced, checked against an end count
     * @return The occurrence, or empty past the end date, once the end count is reached,
     *         beyond the safety horizon, or for a custom pattern
     */
    public Optional<ZonedDateTime> nextOccurrence(RecurrencePattern pattern, Instant after,
                                                  LocalDate anchor, int occurrencesSoFar) {
        if (pattern.frequency() == null || countReached(pattern, occurrencesSoFar)) {
            return Optional.empty();
        }

        LocalDate from = after.atZone(pattern.zone()).toLocalDate();
        LocalDate limit = from.plus(SAFETY_HORIZON);
        if (pattern.endType() == EndType.DATE && pattern.endDate() != null
                && pattern.endDate().isBefore(limit)) {
            limit = pattern.endDate();
        }

        Predicate<LocalDate> later = d -> at(pattern, d).toInstant().isAfter(after);

        Optional<LocalDate> date = switch (pattern.frequency()) {
            case DAILY -> scanDays(from, limit, later.and(d -> matchesDaily(pattern, anchor, d)));
            case WEEKLY -> scanDays(from, limit, later.and(d -> matchesWeekly(pattern, anchor, d)));
            case MONTHLY -> scanMonths(pattern, anchor, from, limit, later);
            case YEARLY -> scanYears(pattern, anchor, from, limit, later);
            case CUSTOM -> Optional.empty();
        };
        return date.map(d -> at(pattern, d));
    }

    /**
     * Whether the pattern skips a date: explicitly excluded, or a holiday when holidays are excluded.
     */
    public boolean isExcluded(RecurrencePattern pattern, LocalDate date) {
        return pattern.excludedDates().contains(date)
            || (pattern.excludeHolidays() && holidays.isHoliday(date));
    }

    // ========== Preview ==========

    /**
     * Upcoming occurrences from a start date (inclusive), anchored at that date.
     * Excluded dates take a slot in the preview but are listed separately.
     *
     * @param pattern The recurrence pattern
     * @param start First date that may hold an occurrence
     * @param count Number of dates to examine
     */
    public RecurrencePreview preview(RecurrencePattern pattern, LocalDate start, int count) {
        validate(pattern);
        if (count < 1 || count > MAX_PREVIEW_COUNT) {
            throw new ValidationException("count", "must be between 1 and " + MAX_PREVIEW_COUNT);
        }

        List<Occurrence> occurrences = new ArrayList<>();
        List<LocalDate> excluded = new ArrayList<>();
        Instant cursor = start.atStartOfDay(pattern.zone()).toInstant().minusNanos(1);

        while (occurrences.size() + excluded.size() < count) {
            Optional<ZonedDateTime> next = nextOccurrence(pattern, cursor, start, occurrences.size());
            if (next.isEmpty()) {
                break;
            }
            ZonedDateTime at = next.get();
            if (isExcluded(pattern, at.toLocalDate())) {
                excluded.add(at.toLocalDate());
            } else {
                occurrences.add(Occurrence.of(at));
            }
            cursor = at.toInstant();
        }

        return new RecurrencePreview(
            occurrences,
            excluded,
            describe(pattern),
            occurrences.isEmpty() ? null : occurrences.get(0).at(),
            pattern.endType() == EndType.DATE ? pattern.endDate() : null,
            pattern.endType() == EndType.COUNT ? pattern.endCount() : null
        );
    }

    // ========== Validation ==========

    /**
     * Check a pattern's structure.
     *
     * @throws ValidationException naming the first offending field
     */
    public void validate(RecurrencePattern pattern) {
        if (pattern == null) {
            throw new ValidationException("pattern", "is required");
        }
        if (pattern.frequency() == null) {
            throw new ValidationException("frequency", "is required");
        }
        if (pattern.interval() < RecurrencePattern.MIN_INTERVAL
                || pattern.interval() > RecurrencePattern.MAX_INTERVAL) {
            throw new ValidationException("interval", String.format("must be between %d and %d, got %d",
                RecurrencePattern.MIN_INTERVAL, RecurrencePattern.MAX_INTERVAL, pattern.interval()));
        }

        switch (pattern.frequency()) {
            case WEEKLY -> {
                if (pattern.weekDays().isEmpty()) {
                    throw new ValidationException("weekDays", "at least one day is required for a weekly pattern");
                }
            }
            case MONTHLY -> validateMonthly(pattern);
            case YEARLY -> validateYearly(pattern);
            default -> {
            }
        }

        if (pattern.endType() == EndType.DATE && pattern.endDate() == null) {
            throw new ValidationException("endDate", "is required when the pattern ends on a date");
        }
        if (pattern.endType() == EndType.COUNT && (pattern.endCount() == null || pattern.endCount() < 1)) {
            throw new ValidationException("endCount", "must be at least 1 when the pattern ends after a count");
        }
    }

    // ========== Description ==========

    /**
     * Human-readable summary, e.g. "Weekly on Monday, Wednesday for 10 occurrences".
     */
    public String describe(RecurrencePattern pattern) {
        List<String> parts = new ArrayList<>();
        int interval = pattern.interval();

        switch (pattern.frequency()) {
            case DAILY -> {
                parts.add(interval == 1 ? "Daily" : "Every " + interval + " days");
                if (pattern.businessDaysOnly()) {
                    parts.add("(business days only)");
                }
            }
            case WEEKLY -> {
                parts.add(interval == 1 ? "Weekly" : "Every " + interval + " weeks");
                if (!pattern.weekDays().isEmpty()) {
                    parts.add("on " + pattern.weekDays().stream()
                        .sorted()
                        .map(RecurrenceCalculator::dayName)
                        .collect(Collectors.joining(", ")));
                }
            }
            case MONTHLY -> {
                parts.add(interval == 1 ? "Monthly" : "Every " + interval + " months");
                if (pattern.monthlyType() == MonthlyType.DATE && pattern.monthDay() != null) {
                    parts.add("on day " + pattern.monthDay());
                } else if (pattern.monthlyType() == MonthlyType.DAY && pattern.monthWeekday() != null) {
                    parts.add("on the " + ordinal(pattern.monthWeek()) + " " + dayName(pattern.monthWeekday()));
                }
            }
            case YEARLY -> {
                parts.add(interval == 1 ? "Yearly" : "Every " + interval + " years");
                if (pattern.yearlyMonth() != null && pattern.yearlyDay() != null) {
                    parts.add("on " + Month.of(pattern.yearlyMonth()).getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                        + " " + pattern.yearlyDay());
                }
            }
            case CUSTOM -> parts.add("Custom schedule");
        }

        if (pattern.endType() == EndType.DATE && pattern.endDate() != null) {
            parts.add("until " + pattern.endDate());
        } else if (pattern.endType() == EndType.COUNT && pattern.endCount() != null) {
            parts.add("for " + pattern.endCount() + " occurrences");
        }
        return String.join(" ", parts);
    }

    // ========== Internal Methods ==========

    private static boolean countReached(RecurrencePattern pattern, int occurrencesSoFar) {
        return pattern.endType() == EndType.COUNT
            && pattern.endCount() != null
            && occurrencesSoFar >= pattern.endCount();
    }

    private static ZonedDateTime at(RecurrencePattern pattern, LocalDate date) {
        return ZonedDateTime.of(date, pattern.occurrenceTime(), pattern.zone());
    }

    private static Optional<LocalDate> scanDays(LocalDate from, LocalDate limit, Predicate<LocalDate> rule) {
        for (LocalDate d = from; !d.isAfter(limit); d = d.plusDays(1)) {
            if (rule.test(d)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesDaily(RecurrencePattern pattern, LocalDate anchor, LocalDate date) {
        if (pattern.businessDaysOnly() && isWeekend(date)) {
            return false;
        }
        return Math.floorMod(ChronoUnit.DAYS.between(anchor, date), pattern.interval()) == 0;
    }

    private static boolean matchesWeekly(RecurrencePattern pattern, LocalDate anchor, LocalDate date) {
        if (!pattern.weekDays().contains(date.getDayOfWeek())) {
            return false;
        }
        long weeks = ChronoUnit.WEEKS.between(weekStart(anchor), weekStart(date));
        return Math.floorMod(weeks, pattern.interval()) == 0;
    }

    private static Optional<LocalDate> scanMonths(RecurrencePattern pattern, LocalDate anchor,
                                                  LocalDate from, LocalDate limit,
                                                  Predicate<LocalDate> later) {
        YearMonth anchorMonth = YearMonth.from(anchor);
        for (YearMonth month = YearMonth.from(from); !month.atDay(1).isAfter(limit); month = month.plusMonths(1)) {
            if (Math.floorMod(ChronoUnit.MONTHS.between(anchorMonth, month), pattern.interval()) != 0) {
                continue;
            }
            Optional<LocalDate> candidate = monthlyDate(pattern, month)
                .filter(d -> !d.isBefore(from) && !d.isAfter(limit))
                .filter(later);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> monthlyDate(RecurrencePattern pattern, YearMonth month) {
        if (pattern.monthlyType() == MonthlyType.DAY) {
            if (pattern.monthWeek() == null || pattern.monthWeekday() == null) {
                return Optional.empty();
            }
            LocalDate date = month.atDay(1)
                .with(TemporalAdjusters.dayOfWeekInMonth(pattern.monthWeek(), pattern.monthWeekday()));
            // A fifth weekday may not exist; the adjuster then rolls into the next month
            return YearMonth.from(date).equals(month) ? Optional.of(date) : Optional.empty();
        }
        Integer day = pattern.monthDay();
        if (day == null || day > month.lengthOfMonth()) {
            return Optional.empty();
        }
        return Optional.of(month.atDay(day));
    }

    private static Optional<LocalDate> scanYears(RecurrencePattern pattern, LocalDate anchor,
                                                 LocalDate from, LocalDate limit,
                                                 Predicate<LocalDate> later) {
        if (pattern.yearlyMonth() == null || pattern.yearlyDay() == null) {
            return Optional.empty();
        }
        MonthDay monthDay = MonthDay.of(pattern.yearlyMonth(), pattern.yearlyDay());
        for (int year = from.getYear(); year <= limit.getYear(); year++) {
            if (Math.floorMod(year - anchor.getYear(), pattern.interval()) != 0 || !monthDay.isValidYear(year)) {
                continue;
            }
            LocalDate date = monthDay.atYear(year);
            if (!date.isBefore(from) && !date.isAfter(limit) && later.test(date)) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    private static void validateMonthly(RecurrencePattern pattern) {
        if (pattern.monthlyType() == MonthlyType.DATE) {
            if (pattern.monthDay() == null || pattern.monthDay() < 1 || pattern.monthDay() > 31) {
                throw new ValidationException("monthDay", "must be between 1 and 31 for a monthly pattern by date");
            }
            return;
        }
        Integer week = pattern.monthWeek();
        if (week == null || week == 0 || week < -1 || week > 5) {
            throw new ValidationException("monthWeek", "must be 1-5, or -1 for the last week");
        }
        if (pattern.monthWeekday() == null) {
            throw new ValidationException("monthWeekday", "is required for a monthly pattern by weekday");
        }
    }

    private static void validateYearly(RecurrencePattern pattern) {
        Integer month = pattern.yearlyMonth();
        if (month == null || month < 1 || month > 12) {
            throw new ValidationException("yearlyMonth", "must be between 1 and 12");
        }
        Integer day = pattern.yearlyDay();
        if (day == null || day < 1 || day > Month.of(month).maxLength()) {
            throw new ValidationException("yearlyDay", "is not a day of " + Month.of(month));
        }
    }

    private static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    static boolean isWeekend(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    private static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static String ordinal(Integer week) {
        if (week == null) {
            return "";
        }
        return switch (week) {
            case -1 -> "last";
            case 1 -> "1st";
            case 2 -> "2nd";
            case 3 -> "3rd";
            default -> week + "th";
        };
    }
}
