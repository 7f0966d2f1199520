package cold.spray.enums;

public enum HealthStatus {
    OK("все хорошо"),

    DEGRADED("небольшие проблемы"),

    ERROR("аварийная ситуация!");

    private final String template;

    HealthStatus(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
