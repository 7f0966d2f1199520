package cold.spray.model;

import cold.spray.enums.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

public class HealthReport {
    private final String component;
    private final HealthStatus status;
    private final Map<String, String> problems;
    private final Instant timestamp;

    public HealthReport(String component, HealthStatus status, Map<String, String> problems, Instant timestamp) {
        this.component = component;
        this.status = status;
        this.problems = Collections.unmodifiableMap(new LinkedHashMap<>(problems));
        this.timestamp = timestamp;
    }

    public String getComponent() {
        return component;
    }

    public HealthStatus getStatus() {
        return status;
    }

    /**
     * Найденные проблемы, ключ - проверяемый тег или узел, значение - описание проблемы
     */
    public Map<String, String> getProblems() {
        return problems;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getFormatted() {
        if (problems.isEmpty()) {
            return component + " - " + status.getTemplate();
        }
        return component + " - " + status.getTemplate() + ":\n* " + problems.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n* "));
    }
}
