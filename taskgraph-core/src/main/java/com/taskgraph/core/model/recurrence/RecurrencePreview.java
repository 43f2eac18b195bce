package com.taskgraph.core.model.recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Upcoming occurrences of a pattern, with skipped dates reported separately.
 */
public record RecurrencePreview(
    List<Occurrence> occurrences,
    List<LocalDate> excludedDates,
    String description,
    ZonedDateTime nextOccurrence,
    LocalDate endDate,
    Integer totalInstances
) {
    public RecurrencePreview {
        occurrences = List.copyOf(occurrences);
        excludedDates = List.copyOf(excludedDates);
    }

    public record Occurrence(
        ZonedDateTime at,
        DayOfWeek dayOfWeek,
        boolean weekend
    ) {
        public static Occurrence of(ZonedDateTime at) {
            DayOfWeek day = at.getDayOfWeek();
            return new Occurrence(at, day, day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY);
        }

        public LocalDate date() {
            return at.toLocalDate();
        }
    }
}
