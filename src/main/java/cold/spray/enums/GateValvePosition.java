package cold.spray.enums;

public enum GateValvePosition {
    OPEN(false, true, "открыт"),

    PARTIAL(true, false, "приоткрыт"),

    CLOSED(false, false, "закрыт");

    private final boolean partial;

    private final boolean open;

    private final String template;

    GateValvePosition(boolean partial, boolean open, String template) {
        this.partial = partial;
        this.open = open;
        this.template = template;
    }

    public boolean isPartial() {
        return partial;
    }

    public boolean isOpen() {
        return open;
    }

    public String getTemplate() {
        return template;
    }
}
