package com.pipe.condition;

import com.pipe.condition.impl.AlwaysFalseCondition;
import com.pipe.condition.impl.AlwaysTrueCondition;
import com.pipe.condition.impl.ProbeCondition;
import com.pipe.condition.impl.TimeCondition;
import com.pipe.exception.ConditionParseException;
import com.pipe.time.DailyWindow;
import com.pipe.time.StaticInterval;
import com.pipe.time.WeeklyWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultConditionRegistry.
 */
class DefaultConditionRegistryTest {

    private DefaultConditionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DefaultConditionRegistry.withDefaults();
    }

    @Test
    @DisplayName("Should parse constants case-insensitively")
    void shouldParseConstants() {
        assertSame(AlwaysTrueCondition.INSTANCE, registry.parse("true"));
        assertSame(AlwaysTrueCondition.INSTANCE, registry.parse("  Always True "));
        assertSame(AlwaysFalseCondition.INSTANCE, registry.parse("FALSE"));
    }

    @Test
    @DisplayName("Should parse a daily window")
    void shouldParseDaily() {
        Condition condition = registry.parse("daily between 8:00 and 17:30");

        TimeCondition time = assertInstanceOf(TimeCondition.class, condition);
        assertEquals(new DailyWindow(LocalTime.of(8, 0), LocalTime.of(17, 30)), time.getWindow());
    }

    @Test
    @DisplayName("Should parse weekly windows with full or short day names")
    void shouldParseWeekly() {
        TimeCondition workdays = (TimeCondition) registry.parse("weekly between Monday and fri");
        TimeCondition sunday = (TimeCondition) registry.parse("weekly on sun");

        assertEquals(WeeklyWindow.between(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), workdays.getWindow());
        assertEquals(WeeklyWindow.on(DayOfWeek.SUNDAY), sunday.getWindow());
    }

    @Test
    @DisplayName("Should parse static intervals")
    void shouldParseStaticIntervals() {
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 8, 0);
        LocalDateTime end = LocalDateTime.of(2024, 1, 2, 8, 0);

        assertEquals(StaticInterval.between(start, end),
                registry.parse("between 2024-01-01 08:00 and 2024-01-02T08:00").cycle());
        assertEquals(StaticInterval.after(start), registry.parse("after 2024-01-01T08:00").cycle());
        assertEquals(StaticInterval.before(end), registry.parse("before 2024-01-02 08:00:00").cycle());
    }

    @Test
    @DisplayName("Should fail when no rule matches")
    void shouldFailWithoutMatchingRule() {
        ConditionParseException e = assertThrows(ConditionParseException.class,
                () -> registry.parse("when the moon is full"));

        assertEquals("when the moon is full", e.getInput());
        assertThrows(ConditionParseException.class, () -> registry.parse(" "));
    }

    @Test
    @DisplayName("Should fail when a matching rule gets invalid values")
    void shouldFailOnInvalidValues() {
        assertThrows(ConditionParseException.class, () -> registry.parse("daily between 25:00 and 26:00"));
        assertThrows(ConditionParseException.class, () -> registry.parse("weekly on someday"));
        assertThrows(ConditionParseException.class, () -> registry.parse("daily between 08:00 and 08:00x"));
    }

    @Test
    @DisplayName("Should use custom rules with captured groups")
    void shouldUseCustomRules() {
        registry.register("free memory above (\\d+) mb",
                groups -> new ProbeCondition("memory>" + groups.get(0), ctx -> Integer.parseInt(groups.get(0)) < 512));

        Condition condition = registry.parse("free memory above 256 MB");

        ProbeCondition probe = assertInstanceOf(ProbeCondition.class, condition);
        assertEquals("memory>256", probe.getName());
        assertTrue(probe.evaluate());
    }

    @Test
    @DisplayName("First matching rule wins")
    void firstMatchingRuleWins() {
        DefaultConditionRegistry custom = new DefaultConditionRegistry()
                .registerExact("ready", () -> AlwaysTrueCondition.INSTANCE)
                .register("re.*", groups -> AlwaysFalseCondition.INSTANCE);

        assertSame(AlwaysTrueCondition.INSTANCE, custom.parse("ready"));
        assertSame(AlwaysFalseCondition.INSTANCE, custom.parse("retry"));
        assertEquals(2, custom.size());
    }
}
