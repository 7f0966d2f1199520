package cold.spray.model;

import cold.spray.enums.Device;
import cold.spray.enums.Scaling;
import cold.spray.enums.TagAccess;
import cold.spray.enums.TagType;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Статическое описание тега, строится один раз из конфигурации тегов
 */
public class TagDefinition {
    private final String path;
    private final String group;
    private final String hardwareAddress;
    private final Device device;
    private final TagType type;
    private final TagAccess access;
    private final String unit;
    private final Double rangeMin;
    private final Double rangeMax;
    private final List<String> options;
    private final Map<String, Integer> speeds;
    private final Scaling scaling;
    private final boolean internal;
    private final String description;
    private final Map<Integer, String> bitDefinitions;

    private TagDefinition(
            String path,
            String hardwareAddress,
            Device device,
            TagType type,
            TagAccess access,
            String unit,
            Double rangeMin,
            Double rangeMax,
            List<String> options,
            Map<String, Integer> speeds,
            Scaling scaling,
            boolean internal,
            String description,
            Map<Integer, String> bitDefinitions
    ) {
        this.path = path;
        this.group = path.split("\\.")[0];
        this.hardwareAddress = hardwareAddress;
        this.device = device;
        this.type = type;
        this.access = access;
        this.unit = unit;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.options = options;
        this.speeds = speeds;
        this.scaling = scaling;
        this.internal = internal;
        this.description = description;
        this.bitDefinitions = bitDefinitions;
    }

    /**
     * Разбор описания тега из конфигурации.
     * Адрес берется из plc_tag, если его нет - из ssh.freq_var, затем из ssh.var
     *
     * @param path полное имя тега (группа + путь внутри группы)
     * @param raw  описание тега из конфигурации
     * @return описание тега, адрес может отсутствовать
     */
    public static TagDefinition fromConfig(String path, Map<?, ?> raw) {
        String address = null;
        Device device = null;
        Object plcTag = raw.get("plc_tag");
        if (plcTag != null) {
            address = plcTag.toString();
            device = Device.PLC;
        } else if (raw.get("ssh") instanceof Map<?, ?> ssh) {
            Object feederVar = ssh.get("freq_var") != null ? ssh.get("freq_var") : ssh.get("var");
            if (feederVar != null) {
                address = feederVar.toString();
                device = Device.FEEDER;
            }
        }

        Double min = null;
        Double max = null;
        if (raw.get("range") instanceof List<?> range && range.size() == 2) {
            min = toDouble(range.get(0));
            max = toDouble(range.get(1));
        } else {
            min = toDouble(raw.get("min_value"));
            max = toDouble(raw.get("max_value"));
        }

        List<String> options = Collections.emptyList();
        if (raw.get("options") instanceof List<?> rawOptions) {
            options = rawOptions.stream().map(Object::toString).toList();
        }

        Map<String, Integer> speeds = new LinkedHashMap<>();
        if (raw.get("speeds") instanceof Map<?, ?> rawSpeeds) {
            rawSpeeds.forEach((label, value) -> speeds.put(label.toString(), ((Number) value).intValue()));
        }

        Map<Integer, String> bits = new TreeMap<>();
        if (raw.get("bit_definitions") instanceof Map<?, ?> rawBits) {
            rawBits.forEach((bit, name) -> bits.put(Integer.valueOf(bit.toString()), name.toString()));
        }

        TagType type = TagType.fromConfig(raw.get("type") != null ? raw.get("type").toString() : null);

        return new TagDefinition(
                path,
                address,
                device,
                type != null ? type : TagType.FLOAT,
                TagAccess.fromConfig(raw.get("access") != null ? raw.get("access").toString() : null),
                raw.get("unit") != null ? raw.get("unit").toString() : null,
                min,
                max,
                options,
                Collections.unmodifiableMap(speeds),
                Scaling.fromConfig(raw.get("scaling") != null ? raw.get("scaling").toString() : null),
                Boolean.TRUE.equals(raw.get("internal")),
                raw.get("description") != null ? raw.get("description").toString() : null,
                Collections.unmodifiableMap(bits)
        );
    }

    private static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        return Double.valueOf(value.toString());
    }

    public String getPath() {
        return path;
    }

    public String getGroup() {
        return group;
    }

    @Nullable
    public String getHardwareAddress() {
        return hardwareAddress;
    }

    @Nullable
    public Device getDevice() {
        return device;
    }

    public TagType getType() {
        return type;
    }

    public TagAccess getAccess() {
        return access;
    }

    @Nullable
    public String getUnit() {
        return unit;
    }

    @Nullable
    public Double getRangeMin() {
        return rangeMin;
    }

    @Nullable
    public Double getRangeMax() {
        return rangeMax;
    }

    public List<String> getOptions() {
        return options;
    }

    public Map<String, Integer> getSpeeds() {
        return speeds;
    }

    public Scaling getScaling() {
        return scaling;
    }

    public boolean isInternal() {
        return internal;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public Map<Integer, String> getBitDefinitions() {
        return bitDefinitions;
    }

    public boolean isMapped() {
        return hardwareAddress != null;
    }

    public boolean isPlcTag() {
        return device == Device.PLC;
    }

    public boolean isFeederTag() {
        return device == Device.FEEDER;
    }

    public boolean isWritable() {
        return access == TagAccess.READ_WRITE;
    }

    public boolean hasSpeeds() {
        return !speeds.isEmpty();
    }

    @Override
    public String toString() {
        return path + " -> " + (hardwareAddress != null ? hardwareAddress : "-") + " (" + type.getConfigName() + ")";
    }
}
