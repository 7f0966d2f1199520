package cold.spray.enums;

import java.util.Locale;

public enum TagAccess {
    READ("только чтение"),

    READ_WRITE("чтение и запись");

    private final String template;

    TagAccess(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public static TagAccess fromConfig(String access) {
        if (access == null) {
            return READ;
        }
        return switch (access.trim().toLowerCase(Locale.ROOT)) {
            case "read/write", "read-write", "read_write", "rw", "write" -> READ_WRITE;
            default -> READ;
        };
    }
}
