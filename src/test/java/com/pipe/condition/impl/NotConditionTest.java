package com.pipe.condition.impl;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;
import com.pipe.time.DailyWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NotCondition.
 */
class NotConditionTest {

    private static final LocalDateTime NINE_AM = LocalDateTime.of(2024, 1, 15, 9, 0);

    private final TimeCondition office = TimeCondition.daily(LocalTime.of(8, 0), LocalTime.of(17, 0));

    @Test
    @DisplayName("Should negate the wrapped condition")
    void shouldNegate() {
        ConditionContext context = ConditionContext.fixed(NINE_AM);

        assertFalse(NotCondition.of(AlwaysTrueCondition.INSTANCE).evaluate(context));
        assertTrue(NotCondition.of(AlwaysFalseCondition.INSTANCE).evaluate(context));
        assertFalse(office.not().evaluate(context));
        assertEquals(ConditionType.NOT, office.not().getType());
    }

    @Test
    @DisplayName("Double negation returns the original condition")
    void doubleNegationReturnsOriginal() {
        assertSame(office, NotCondition.of(NotCondition.of(office)));
        assertSame(office, office.not().not());
        assertSame(office, ((NotCondition) office.not()).getCondition());
    }

    @Test
    @DisplayName("Cycle is the complement of a temporal child")
    void cycleIsComplementOfTimeCondition() {
        assertEquals(new DailyWindow(LocalTime.of(17, 0), LocalTime.of(8, 0)), office.not().cycle());
    }

    @Test
    @DisplayName("Cycle cannot be determined for non-temporal children")
    void cycleIsUnboundedOtherwise() {
        assertTrue(AlwaysTrueCondition.INSTANCE.not().cycle().isUnbounded());
        assertTrue(AnyCondition.of(office, AlwaysFalseCondition.INSTANCE).not().cycle().isUnbounded());
    }

    @Test
    @DisplayName("Estimate follows the complement of a temporal child")
    void estimateOfNegatedTimeCondition() {
        NotCondition notOffice = (NotCondition) office.not();

        assertEquals(Duration.ofHours(8), notOffice.estimateTimeToNextPossibleChange(NINE_AM));
        assertEquals(Duration.ZERO, notOffice.estimateTimeToNextPossibleChange(NINE_AM.withHour(18)));
    }

    @Test
    @DisplayName("Estimate of a negated composite is the composite's estimate")
    void estimateOfNegatedComposite() {
        TimeCondition later = TimeCondition.daily(LocalTime.of(11, 0), LocalTime.of(12, 0));
        NotCondition not = (NotCondition) AnyCondition.of(later).not();

        assertEquals(Duration.ofHours(2), not.estimateTimeToNextPossibleChange(NINE_AM));
        assertEquals(Duration.ZERO,
                ((NotCondition) new ProbeCondition("ram", ctx -> true).not())
                        .estimateTimeToNextPossibleChange(NINE_AM));
    }

    @Test
    @DisplayName("Should forward unwrap to the wrapped condition")
    void shouldForwardUnwrap() {
        Condition not = office.not();

        assertSame(office, not.unwrap(TimeCondition.class).orElseThrow());
        assertSame(not, not.unwrap(NotCondition.class).orElseThrow());
        assertTrue(not.unwrap(ProbeCondition.class).isEmpty());
    }

    @Test
    @DisplayName("Should describe itself")
    void shouldDescribeItself() {
        assertEquals("~true", AlwaysTrueCondition.INSTANCE.not().toString());
        assertEquals("~<is daily between 08:00 and 17:00>", office.not().toString());
    }
}
