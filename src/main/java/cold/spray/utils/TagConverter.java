package cold.spray.utils;

import cold.spray.enums.Scaling;
import cold.spray.model.TagDefinition;

import java.util.Map;

/* Перевод значений между инженерными единицами и представлением оборудования */
public class TagConverter {

    /**
     * Инженерное значение в значение для записи в оборудование
     *
     * @param definition описание тега
     * @param value      инженерное значение, для тегов со скоростями может быть названием скорости
     * @return значение для оборудования
     */
    public static Object toHardware(TagDefinition definition, Object value) {
        if (definition.hasSpeeds() && value instanceof String) {
            Integer speedValue = definition.getSpeeds().get(value);
            if (speedValue == null) {
                throw new IllegalArgumentException("Неизвестная скорость " + value + " для тега "
                        + definition.getPath());
            }
            return speedValue;
        }
        if (definition.getScaling().is12Bit() && definition.getRangeMax() != null) {
            return scaleTo12Bit(((Number) value).doubleValue(), definition.getRangeMax());
        }
        return definition.getType().coerce(value);
    }

    /**
     * Значение из оборудования в инженерное значение
     *
     * @param definition описание тега
     * @param rawValue   значение, прочитанное из оборудования
     * @return инженерное значение
     */
    public static Object toEngineering(TagDefinition definition, Object rawValue) {
        if (definition.getScaling().is12Bit() && definition.getRangeMax() != null && rawValue instanceof Number) {
            double scaled = scaleFrom12Bit(((Number) rawValue).intValue(), definition.getRangeMax());
            return definition.getType().coerce(scaled);
        }
        if (definition.hasSpeeds() && rawValue instanceof Number) {
            int raw = ((Number) rawValue).intValue();
            for (Map.Entry<String, Integer> speed : definition.getSpeeds().entrySet()) {
                if (speed.getValue() == raw) {
                    return speed.getKey();
                }
            }
            /* не у каждого значения оборудования есть имя скорости, такие отдаем как есть */
        }
        return definition.getType().coerce(rawValue);
    }

    public static int scaleTo12Bit(double engineeringValue, double rangeMax) {
        return (int) Math.round(engineeringValue * Scaling.MAX_12BIT / rangeMax);
    }

    public static double scaleFrom12Bit(int hardwareValue, double rangeMax) {
        return hardwareValue * rangeMax / Scaling.MAX_12BIT;
    }
}
