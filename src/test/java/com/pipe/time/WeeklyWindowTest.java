package com.pipe.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WeeklyWindow.
 */
class WeeklyWindowTest {

    // 2024-01-15 is a Monday
    private static final LocalDateTime MONDAY = LocalDateTime.of(2024, 1, 15, 0, 0);

    @Test
    @DisplayName("Workdays contain Monday through Friday")
    void workdaysMembership() {
        TimeWindow workdays = WeeklyWindow.between(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

        assertTrue(workdays.contains(MONDAY));
        assertTrue(workdays.contains(MONDAY.plusDays(4).withHour(23).withMinute(59)));
        assertFalse(workdays.contains(MONDAY.plusDays(5)));
        assertFalse(workdays.contains(MONDAY.plusDays(6).withHour(12)));
    }

    @Test
    @DisplayName("Weekend rolls forward to Saturday midnight")
    void weekendRollsForward() {
        TimeWindow weekend = WeeklyWindow.between(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

        TimeInterval next = weekend.rollForward(MONDAY.withHour(10)).orElseThrow();

        assertEquals(LocalDateTime.of(2024, 1, 20, 0, 0), next.start());
        assertEquals(LocalDateTime.of(2024, 1, 22, 0, 0), next.end());
    }

    @Test
    @DisplayName("Friday through Monday wraps the week")
    void fridayThroughMondayWraps() {
        TimeWindow longWeekend = WeeklyWindow.between(DayOfWeek.FRIDAY, DayOfWeek.MONDAY);

        assertTrue(longWeekend.contains(MONDAY.withHour(10)));
        assertTrue(longWeekend.contains(MONDAY.minusDays(1)));
        assertFalse(longWeekend.contains(MONDAY.plusDays(1)));

        TimeInterval current = longWeekend.rollForward(MONDAY.withHour(10)).orElseThrow();
        assertEquals(MONDAY.withHour(10), current.start());
        assertEquals(MONDAY.plusDays(1), current.end());
    }

    @Test
    @DisplayName("Single day window")
    void singleDay() {
        TimeWindow wednesday = WeeklyWindow.on(DayOfWeek.WEDNESDAY);

        assertTrue(wednesday.contains(MONDAY.plusDays(2).withHour(13)));
        assertFalse(wednesday.contains(MONDAY.plusDays(3)));
    }

    @Test
    @DisplayName("Whole week is unbounded")
    void wholeWeekIsUnbounded() {
        assertTrue(WeeklyWindow.between(DayOfWeek.MONDAY, DayOfWeek.SUNDAY).isUnbounded());
    }

    @Test
    @DisplayName("Complement of workdays is the weekend")
    void complementOfWorkdays() {
        TimeWindow workdays = WeeklyWindow.between(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

        assertEquals(WeeklyWindow.between(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), workdays.complement());
    }

    @Test
    @DisplayName("Should describe itself")
    void shouldDescribeItself() {
        assertEquals("weekly between MONDAY 00:00 and SATURDAY 00:00",
                WeeklyWindow.between(DayOfWeek.MONDAY, DayOfWeek.FRIDAY).toString());
    }
}
