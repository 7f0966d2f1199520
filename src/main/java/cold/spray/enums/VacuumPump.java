package cold.spray.enums;

public enum VacuumPump {
    MECHANICAL("vacuum_control.mechanical_pump", "форвакуумный насос"),

    BOOSTER("vacuum_control.booster_pump", "бустерный насос");

    private final String tagPrefix;

    private final String template;

    VacuumPump(String tagPrefix, String template) {
        this.tagPrefix = tagPrefix;
        this.template = template;
    }

    public String getStartTag() {
        return tagPrefix + ".start";
    }

    public String getStopTag() {
        return tagPrefix + ".stop";
    }

    public String getTemplate() {
        return template;
    }
}
