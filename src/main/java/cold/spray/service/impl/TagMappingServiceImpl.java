package cold.spray.service.impl;

import cold.spray.configuration.TagsConfiguration;
import cold.spray.enums.Device;
import cold.spray.event.info.TagsConfigurationUpdatedEvent;
import cold.spray.exception.UnknownTagException;
import cold.spray.model.TagDefinition;
import cold.spray.model.TagMappingTable;
import cold.spray.service.TagMappingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class TagMappingServiceImpl implements TagMappingService {
    private static final Logger logger = LoggerFactory.getLogger(TagMappingServiceImpl.class);
    private static final String GROUPS_KEY = "tag_groups";
    private static final String TAGS_KEY = "tags";
    private static final Set<String> TAG_ENTRY_KEYS = Set.of("type", "mapped", "plc_tag", "ssh", "internal", "access");
    private final TagsConfiguration tagsConfiguration;
    private volatile TagMappingTable table = TagMappingTable.empty();

    public TagMappingServiceImpl(TagsConfiguration tagsConfiguration) {
        this.tagsConfiguration = tagsConfiguration;
        rebuild();
    }

    @Override
    @CacheEvict(value = "tag_groups", allEntries = true)
    public void buildMappings(Map<String, Object> tagConfig) {
        logger.debug("Строим таблицы сопоставления тегов");
        Map<String, TagDefinition> definitions = new LinkedHashMap<>();
        Map<Device, Map<String, String>> usedAddresses = new EnumMap<>(Device.class);
        for (Device device : Device.values()) {
            usedAddresses.put(device, new HashMap<>());
        }

        Object groups = tagConfig.containsKey(GROUPS_KEY) ? tagConfig.get(GROUPS_KEY) : tagConfig;
        if (groups instanceof Map<?, ?> groupMap) {
            groupMap.forEach((group, content) -> {
                if (!(content instanceof Map<?, ?> groupContent)) {
                    return;
                }
                Object tags = groupContent.get(TAGS_KEY);
                Map<?, ?> entries = tags instanceof Map<?, ?> tagMap ? tagMap : groupContent;
                collect(group.toString(), entries, definitions, usedAddresses);
            });
        }

        table = new TagMappingTable(definitions, Instant.now());
        logger.info("Таблицы сопоставления построены, тегов: {}", definitions.size());
    }

    private void collect(
            String prefix,
            Map<?, ?> entries,
            Map<String, TagDefinition> definitions,
            Map<Device, Map<String, String>> usedAddresses
    ) {
        entries.forEach((key, value) -> {
            if (!(value instanceof Map<?, ?> child)) {
                return;
            }
            String path = prefix + "." + key;
            if (isTagEntry(child)) {
                register(path, child, definitions, usedAddresses);
            } else {
                collect(path, child, definitions, usedAddresses);
            }
        });
    }

    private boolean isTagEntry(Map<?, ?> entry) {
        return entry.keySet().stream().anyMatch(key -> TAG_ENTRY_KEYS.contains(key.toString()));
    }

    private void register(
            String path,
            Map<?, ?> raw,
            Map<String, TagDefinition> definitions,
            Map<Device, Map<String, String>> usedAddresses
    ) {
        TagDefinition definition = TagDefinition.fromConfig(path, raw);
        boolean mapped = Boolean.TRUE.equals(raw.get("mapped"));

        if (!mapped) {
            if (definition.isInternal()) {
                definitions.put(path, definition);
                logger.debug("Внутренний тег {} без адреса оборудования", path);
            }
            return;
        }
        if (!definition.isMapped()) {
            logger.warn("Тег {} отмечен как сопоставленный, но не имеет ни plc_tag, ни ssh адреса, пропускаем", path);
            return;
        }

        Map<String, String> deviceAddresses = usedAddresses.get(definition.getDevice());
        String owner = deviceAddresses.get(definition.getHardwareAddress());
        if (owner != null) {
            logger.warn("Адрес {} уже сопоставлен с тегом {}, тег {} пропускаем",
                    definition.getHardwareAddress(), owner, path);
            return;
        }
        deviceAddresses.put(definition.getHardwareAddress(), path);
        definitions.put(path, definition);
    }

    @Override
    @CacheEvict(value = "tag_groups", allEntries = true)
    public void rebuild() {
        buildMappings(tagsConfiguration.loadTagConfig());
    }

    @EventListener
    @CacheEvict(value = "tag_groups", allEntries = true)
    public void onTagsConfigurationUpdatedEvent(TagsConfigurationUpdatedEvent event) {
        logger.info("Конфигурация тегов обновлена, перестраиваем таблицы сопоставления");
        if (event.getTagConfig() != null) {
            buildMappings(event.getTagConfig());
        } else {
            rebuild();
        }
    }

    @Override
    public String toHardwareTag(String mappedName) throws UnknownTagException {
        TagDefinition definition = table.getDefinition(mappedName);
        if (definition == null || !definition.isMapped()) {
            throw new UnknownTagException(mappedName);
        }
        return definition.getHardwareAddress();
    }

    @Override
    public String toMappedName(String hardwareAddress) throws UnknownTagException {
        String mappedName = table.getMappedName(hardwareAddress);
        if (mappedName == null) {
            throw new UnknownTagException(hardwareAddress);
        }
        return mappedName;
    }

    @Override
    public String toMappedName(Device device, String hardwareAddress) throws UnknownTagException {
        String mappedName = table.getMappedName(device, hardwareAddress);
        if (mappedName == null) {
            throw new UnknownTagException(hardwareAddress);
        }
        return mappedName;
    }

    @Override
    public TagDefinition getTagMetadata(String mappedName) throws UnknownTagException {
        TagDefinition definition = table.getDefinition(mappedName);
        if (definition == null) {
            throw new UnknownTagException(mappedName);
        }
        return definition;
    }

    @Override
    public TagMappingTable getMappingTable() {
        return table;
    }

    @Override
    public boolean isPlcTag(String mappedName) {
        TagDefinition definition = table.getDefinition(mappedName);
        return definition != null && definition.isPlcTag();
    }

    @Override
    public boolean isFeederTag(String mappedName) {
        TagDefinition definition = table.getDefinition(mappedName);
        return definition != null && definition.isFeederTag();
    }

    @Override
    @Cacheable("tag_groups")
    public List<TagDefinition> getTagsInGroup(String group) {
        logger.debug("Собираем теги группы {}", group);
        return table.getDefinitions().values().stream()
                .filter(definition -> definition.getGroup().equals(group))
                .toList();
    }

    @Override
    public Collection<TagDefinition> getAllDefinitions() {
        return table.getDefinitions().values();
    }
}
