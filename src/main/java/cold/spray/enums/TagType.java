package cold.spray.enums;

import java.util.Locale;

public enum TagType {
    FLOAT("float", "число с плавающей точкой"),

    INTEGER("integer", "целое число"),

    BOOL("bool", "логическое значение"),

    STRING("string", "строка");

    private final String configName;

    private final String template;

    TagType(String configName, String template) {
        this.configName = configName;
        this.template = template;
    }

    public String getConfigName() {
        return configName;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * Тип тега по значению поля type из конфигурации тегов
     *
     * @param configName значение поля type
     * @return тип или null, если тип не поддерживается для работы с оборудованием
     */
    public static TagType fromConfig(String configName) {
        if (configName == null) {
            return null;
        }
        return switch (configName.trim().toLowerCase(Locale.ROOT)) {
            case "float", "double" -> FLOAT;
            case "integer", "int" -> INTEGER;
            case "bool", "boolean" -> BOOL;
            case "string", "str" -> STRING;
            default -> null;
        };
    }

    /**
     * Проверка, что значение подходит под тип тега
     *
     * @param value значение в инженерных единицах
     * @return true если тип значения совпадает с типом тега
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case FLOAT -> value instanceof Number;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte;
            case BOOL -> value instanceof Boolean;
            case STRING -> value instanceof String;
        };
    }

    /**
     * Приведение сырого значения к представлению типа тега.
     * Числа приводятся к Double или Integer, логические значения принимаются и в виде 0/1
     *
     * @param value сырое значение
     * @return значение, приведенное к типу тега
     * @throws IllegalArgumentException если значение не приводится к типу
     */
    public Object coerce(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Пустое значение нельзя привести к типу " + configName);
        }
        return switch (this) {
            case FLOAT -> Double.valueOf(toDouble(value));
            case INTEGER -> Integer.valueOf((int) Math.round(toDouble(value)));
            case BOOL -> Boolean.valueOf(toBoolean(value));
            case STRING -> value.toString();
        };
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString().trim());
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
