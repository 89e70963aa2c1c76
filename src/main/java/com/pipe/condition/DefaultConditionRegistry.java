package com.pipe.condition;

import com.pipe.condition.impl.AlwaysFalseCondition;
import com.pipe.condition.impl.AlwaysTrueCondition;
import com.pipe.condition.impl.TimeCondition;
import com.pipe.exception.ConditionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default implementation of ConditionRegistry.
 * Tries an ordered list of (pattern, factory) rules and returns the condition
 * built by the first rule whose pattern matches the whole item.
 */
public class DefaultConditionRegistry implements ConditionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionRegistry.class);

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm");
    private static final String TIME = "(\\d{1,2}:\\d{2})";
    private static final String DAY = "([a-z]+)";
    private static final String DATE_TIME = "(\\d{4}-\\d{2}-\\d{2}[t ]\\d{2}:\\d{2}(?::\\d{2})?)";

    private final List<ConditionRule> rules = new CopyOnWriteArrayList<>();

    /**
     * Create a registry with the built-in constant and time rules.
     */
    public static DefaultConditionRegistry withDefaults() {
        DefaultConditionRegistry registry = new DefaultConditionRegistry();
        registry.registerExact("true", () -> AlwaysTrueCondition.INSTANCE);
        registry.registerExact("always true", () -> AlwaysTrueCondition.INSTANCE);
        registry.registerExact("false", () -> AlwaysFalseCondition.INSTANCE);
        registry.registerExact("always false", () -> AlwaysFalseCondition.INSTANCE);
        registry.register("daily between " + TIME + " and " + TIME,
                groups -> TimeCondition.daily(parseTime(groups.get(0)), parseTime(groups.get(1))));
        registry.register("weekly between " + DAY + " and " + DAY,
                groups -> TimeCondition.weekly(parseDay(groups.get(0)), parseDay(groups.get(1))));
        registry.register("weekly on " + DAY,
                groups -> TimeCondition.on(parseDay(groups.get(0))));
        registry.register("between " + DATE_TIME + " and " + DATE_TIME,
                groups -> TimeCondition.between(parseDateTime(groups.get(0)), parseDateTime(groups.get(1))));
        registry.register("after " + DATE_TIME,
                groups -> TimeCondition.after(parseDateTime(groups.get(0))));
        registry.register("before " + DATE_TIME,
                groups -> TimeCondition.before(parseDateTime(groups.get(0))));
        return registry;
    }

    /**
     * Add a rule matched as a case-insensitive regular expression.
     * The capture groups of the match are passed to the factory.
     *
     * @param regex   Pattern the whole item must match
     * @param factory Creates the condition from the captured groups
     * @return this registry for chaining
     */
    public DefaultConditionRegistry register(String regex, Function<List<String>, Condition> factory) {
        rules.add(new ConditionRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), factory));
        log.debug("Registered condition rule: {}", regex);
        return this;
    }

    /**
     * Add a rule matched as exact text (case-insensitive).
     */
    public DefaultConditionRegistry registerExact(String text, Supplier<Condition> factory) {
        Pattern pattern = Pattern.compile(Pattern.quote(text), Pattern.CASE_INSENSITIVE);
        rules.add(new ConditionRule(pattern, groups -> factory.get()));
        log.debug("Registered exact condition rule: {}", text);
        return this;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public Condition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionParseException(String.valueOf(text), "Condition item cannot be blank");
        }
        String item = text.trim();
        for (ConditionRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(item);
            if (!matcher.matches()) {
                continue;
            }
            List<String> groups = new ArrayList<>(matcher.groupCount());
            for (int i = 1; i <= matcher.groupCount(); i++) {
                groups.add(matcher.group(i));
            }
            try {
                Condition condition = rule.factory().apply(groups);
                log.debug("Parsed '{}' as {}", item, condition);
                return condition;
            } catch (DateTimeException | IllegalArgumentException e) {
                throw new ConditionParseException(item, "Invalid condition: " + e.getMessage(), e);
            }
        }
        throw new ConditionParseException(item, "Cannot parse the condition");
    }

    private static LocalTime parseTime(String text) {
        return LocalTime.parse(text, TIME_OF_DAY);
    }

    private static LocalDateTime parseDateTime(String text) {
        return LocalDateTime.parse(text.toUpperCase(Locale.ROOT).replace(' ', 'T'));
    }

    private static DayOfWeek parseDay(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.length() >= 3) {
            for (DayOfWeek day : DayOfWeek.values()) {
                if (day.name().startsWith(upper)) {
                    return day;
                }
            }
        }
        throw new IllegalArgumentException("Unknown day of week '" + text + "'");
    }

    /**
     * A parsing rule: pattern + condition factory.
     */
    private record ConditionRule(Pattern pattern, Function<List<String>, Condition> factory) {
    }
}
