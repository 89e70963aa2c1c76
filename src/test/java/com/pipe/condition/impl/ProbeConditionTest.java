package com.pipe.condition.impl;

import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;
import com.pipe.exception.ConditionEvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProbeCondition.
 */
class ProbeConditionTest {

    private final ConditionContext context = ConditionContext.systemDefault();

    @Test
    @DisplayName("Should return the probe result")
    void shouldReturnProbeResult() {
        assertTrue(new ProbeCondition("ram", ctx -> true).evaluate(context));
        assertFalse(new ProbeCondition("ram", ctx -> false).evaluate(context));
        assertEquals(ConditionType.PROBE, new ProbeCondition("ram", ctx -> true).getType());
    }

    @Test
    @DisplayName("Should call the probe on every evaluation")
    void shouldCallProbeEachTime() {
        AtomicInteger calls = new AtomicInteger();
        ProbeCondition probe = new ProbeCondition("counter", ctx -> calls.incrementAndGet() > 1);

        assertFalse(probe.evaluate(context));
        assertTrue(probe.evaluate(context));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should signal a failing probe as an evaluation error")
    void shouldWrapProbeFailure() {
        ProbeCondition probe = new ProbeCondition("disk", ctx -> {
            throw new IOException("mount missing");
        });

        ConditionEvaluationException e = assertThrows(ConditionEvaluationException.class,
                () -> probe.evaluate(context));

        assertEquals("disk", e.getCondition());
        assertEquals("Cannot evaluate disk: mount missing", e.getMessage());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("Should pass evaluation errors through unchanged")
    void shouldPassEvaluationErrorsThrough() {
        ConditionEvaluationException original = new ConditionEvaluationException("upstream", "not ready");
        ProbeCondition probe = new ProbeCondition("dependency", ctx -> {
            throw original;
        });

        assertSame(original, assertThrows(ConditionEvaluationException.class, () -> probe.evaluate(context)));
    }

    @Test
    @DisplayName("Should require a name and a probe")
    void shouldValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ProbeCondition(" ", ctx -> true));
        assertThrows(IllegalArgumentException.class, () -> new ProbeCondition("ram", null));
    }
}
