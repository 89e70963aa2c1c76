package com.pipe.config;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionRegistry;
import com.pipe.exception.ConditionParseException;
import com.pipe.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads scheduler condition configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path     Path to the configuration file
     * @param registry Registry resolving condition items
     * @return Loaded configuration
     */
    public static SchedulerConfig load(String path, ConditionRegistry registry) {
        log.info("Loading scheduler configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream, registry);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static SchedulerConfig parseYaml(InputStream inputStream, ConditionRegistry registry) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The scheduler section may be at root or under the 'scheduler' key
        Map<String, Object> schedulerMap = root.containsKey("scheduler")
                ? (Map<String, Object>) root.get("scheduler")
                : root;

        String name = getString(schedulerMap, "name", "default-scheduler");
        ZoneId zone = parseZone(getString(schedulerMap, "zone", null));
        Duration minSleep = Duration.ofMillis(getLong(schedulerMap, "min-sleep-ms", 100));
        Duration maxSleep = Duration.ofMillis(getLong(schedulerMap, "max-sleep-ms", 60_000));

        if (minSleep.isNegative() || minSleep.compareTo(maxSleep) > 0) {
            throw new ConfigurationException("min-sleep-ms must be between 0 and max-sleep-ms, got "
                    + minSleep.toMillis() + " and " + maxSleep.toMillis());
        }

        ConditionExpressionParser parser = new ConditionExpressionParser(registry);
        List<TaskConfig> tasks = parseTasks((List<Map<String, Object>>) schedulerMap.get("tasks"), parser);

        if (tasks.isEmpty()) {
            log.warn("No tasks configured for scheduler '{}'", name);
        }

        SchedulerConfig config = new SchedulerConfig(name, zone, minSleep, maxSleep, tasks);

        log.info("Loaded scheduler configuration: {} with {} tasks, zone: {}, sleep: {}-{} ms",
                name, tasks.size(), zone, minSleep.toMillis(), maxSleep.toMillis());

        return config;
    }

    private static List<TaskConfig> parseTasks(List<Map<String, Object>> list, ConditionExpressionParser parser) {
        if (list == null) {
            return List.of();
        }
        List<TaskConfig> tasks = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> taskMap = list.get(i);
            String name = getString(taskMap, "name", "task-" + i);
            if (!names.add(name)) {
                throw new ConfigurationException("Duplicate task name '" + name + "'");
            }
            String expression = getString(taskMap, "condition", null);
            Condition condition;
            try {
                condition = parser.parse(expression);
            } catch (ConditionParseException e) {
                throw new ConfigurationException("Task '" + name + "' has an invalid condition: "
                        + e.getMessage(), e);
            }
            tasks.add(new TaskConfig(name, expression, condition));
            log.debug("Parsed task: name={}, condition={}", name, condition);
        }
        return tasks;
    }

    private static ZoneId parseZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown time zone '" + zone + "'", e);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + value + "'", e);
        }
    }
}
