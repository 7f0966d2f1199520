package cold.spray.enums;

public enum Scaling {
    NONE(null),

    LINEAR_12BIT("12bit_linear"),

    DAC_12BIT("12bit_dac");

    /* верхняя граница 12-битного диапазона АЦП/ЦАП */
    public static final int MAX_12BIT = 4095;

    private final String configName;

    Scaling(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public boolean is12Bit() {
        return this == LINEAR_12BIT || this == DAC_12BIT;
    }

    public static Scaling fromConfig(String scaling) {
        if (scaling == null) {
            return NONE;
        }
        for (Scaling value : values()) {
            if (scaling.trim().equalsIgnoreCase(value.configName)) {
                return value;
            }
        }
        return NONE;
    }
}
