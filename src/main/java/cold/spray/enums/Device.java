package cold.spray.enums;

public enum Device {
    PLC("plc", "ПЛК"),

    FEEDER("feeder", "контроллер питателя");

    private final String tag;

    private final String template;

    Device(String tag, String template) {
        this.tag = tag;
        this.template = template;
    }

    public String getTag() {
        return tag;
    }

    public String getTemplate() {
        return template;
    }
}
