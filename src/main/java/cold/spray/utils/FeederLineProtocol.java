package cold.spray.utils;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Locale;

/* Текстовый протокол gpascii контроллера питателя: P-переменные читаются и пишутся построчно */
public class FeederLineProtocol {
    public static final String LINE_MODE_COMMAND = "gpascii -2\r\n";
    public static final String ECHO_COMMAND = "echo1\n\r";

    public static String formatWrite(String address, Object value) {
        return address + "=" + formatValue(value) + "\n";
    }

    public static String formatRead(String address) {
        return address + "\n";
    }

    /**
     * Разбор строки ответа вида P6=1200
     *
     * @param address ожидаемая переменная
     * @param line    строка ответа
     * @return текст значения после '=' или null, если строка не является ответом для этой переменной
     */
    public static String parseResponse(String address, String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith(address + "=")) {
            return null;
        }
        return trimmed.substring(address.length() + 1).trim();
    }

    /**
     * Значение из текста ответа: целое, дробное (контроллер отдает его с точкой) или строка как есть
     */
    public static Object parseValue(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        if (!NumberUtils.isParsable(trimmed)) {
            return trimmed;
        }
        if (trimmed.indexOf('.') < 0) {
            double number = Double.parseDouble(trimmed);
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        return Double.valueOf(trimmed);
    }

    public static String formatValue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number)) {
                return String.valueOf((long) number);
            }
        }
        return String.valueOf(value);
    }

    public static boolean isError(String response) {
        return StringUtils.isNotEmpty(response) && response.toLowerCase(Locale.ROOT).contains("error");
    }
}
