package cold.spray.model;

import cold.spray.enums.Device;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Неизменяемый снимок таблиц сопоставления тегов.
 * При перестроении создается новый снимок целиком, читатели видят либо старый, либо новый
 */
public class TagMappingTable {
    private final Map<String, TagDefinition> definitions;
    private final Map<Device, Map<String, String>> hardwareToMapped;
    private final Instant builtAt;

    public TagMappingTable(Map<String, TagDefinition> definitions, Instant builtAt) {
        Map<Device, Map<String, String>> reverse = new EnumMap<>(Device.class);
        for (Device device : Device.values()) {
            reverse.put(device, new HashMap<>());
        }
        definitions.values().stream()
                .filter(TagDefinition::isMapped)
                .forEach(definition ->
                        reverse.get(definition.getDevice()).put(definition.getHardwareAddress(), definition.getPath()));
        reverse.replaceAll((device, table) -> Collections.unmodifiableMap(table));

        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.hardwareToMapped = Collections.unmodifiableMap(reverse);
        this.builtAt = builtAt;
    }

    public static TagMappingTable empty() {
        return new TagMappingTable(Collections.emptyMap(), Instant.EPOCH);
    }

    public Map<String, TagDefinition> getDefinitions() {
        return definitions;
    }

    public TagDefinition getDefinition(String mappedName) {
        return definitions.get(mappedName);
    }

    public String getMappedName(Device device, String hardwareAddress) {
        return hardwareToMapped.get(device).get(hardwareAddress);
    }

    public String getMappedName(String hardwareAddress) {
        for (Device device : Device.values()) {
            String mappedName = getMappedName(device, hardwareAddress);
            if (mappedName != null) {
                return mappedName;
            }
        }
        return null;
    }

    public int size() {
        return definitions.size();
    }

    public Instant getBuiltAt() {
        return builtAt;
    }
}
