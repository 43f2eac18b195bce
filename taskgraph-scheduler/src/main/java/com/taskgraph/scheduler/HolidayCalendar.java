package com.taskgraph.scheduler;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Collection;
import java.util.Set;

/**
 * Dates on which recurring work is not scheduled when a pattern excludes holidays.
 */
public interface HolidayCalendar {

    boolean isHoliday(LocalDate date);

    /**
     * Holidays falling on the same month and day every year.
     */
    static HolidayCalendar fixed(Collection<MonthDay> days) {
        Set<MonthDay> holidays = Set.copyOf(days);
        return date -> holidays.contains(MonthDay.from(date));
    }

    /**
     * New Year's Day, Independence Day and Christmas Day.
     */
    static HolidayCalendar standard() {
        return fixed(Set.of(
            MonthDay.of(1, 1),
            MonthDay.of(7, 4),
            MonthDay.of(12, 25)
        ));
    }
}
