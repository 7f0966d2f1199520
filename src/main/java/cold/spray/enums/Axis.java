package cold.spray.enums;

public enum Axis {
    X("x", "ось X"),

    Y("y", "ось Y"),

    Z("z", "ось Z");

    private static final String MOVE_PREFIX = "motion.motion_control.relative_move.";

    private final String name;

    private final String template;

    Axis(String name, String template) {
        this.name = name;
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public String getPositionTag() {
        return "motion.position." + name + "_position";
    }

    public String getStatusTag() {
        return "motion.status." + name + "_axis";
    }

    public String getTriggerTag() {
        return MOVE_PREFIX + name + "_move.trigger";
    }

    public String getParameterTag(String parameter) {
        return MOVE_PREFIX + name + "_move.parameters." + parameter;
    }

    public String getInProgressTag() {
        return getParameterTag("in_progress");
    }
}
