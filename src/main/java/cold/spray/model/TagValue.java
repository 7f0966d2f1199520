package cold.spray.model;

import cold.spray.enums.TagType;

import java.time.Instant;

/**
 * Значение тега в инженерных единицах с временем последнего обновления.
 * Объект неизменяемый, при обновлении в кэш кладется новый экземпляр
 */
public class TagValue {
    private final Object value;
    private final TagDefinition definition;
    private final Instant timestamp;

    public TagValue(Object value, TagDefinition definition, Instant timestamp) {
        this.value = value;
        this.definition = definition;
        this.timestamp = timestamp;
    }

    public Object getValue() {
        return value;
    }

    public TagDefinition getDefinition() {
        return definition;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public TagType getType() {
        return definition.getType();
    }

    public Double asDouble() {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    public Integer asInteger() {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    public Boolean asBoolean() {
        return value instanceof Boolean ? (Boolean) value : null;
    }

    @Override
    public String toString() {
        return definition.getPath() + "=" + value + " @ " + timestamp;
    }
}
