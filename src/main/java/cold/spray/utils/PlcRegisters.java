package cold.spray.utils;

import cold.spray.model.PlcTagAddress.DataType;

/* 32-битные значения ПЛК лежат в двух регистрах, младшее слово первым */
public class PlcRegisters {

    public static Object decode(DataType dataType, int[] registers, int index) {
        return switch (dataType) {
            case BOOLEAN -> registers[index] != 0;
            case INT16 -> (int) (short) registers[index];
            case INT32 -> toInt32(registers[index], registers[index + 1]);
            case FLOAT32 -> Float.intBitsToFloat(toInt32(registers[index], registers[index + 1]));
        };
    }

    public static int[] encode(DataType dataType, Object value) {
        return switch (dataType) {
            case BOOLEAN -> new int[]{toBoolean(value) ? 1 : 0};
            case INT16 -> new int[]{((Number) value).intValue() & 0xFFFF};
            case INT32 -> split(((Number) value).intValue());
            case FLOAT32 -> split(Float.floatToIntBits(((Number) value).floatValue()));
        };
    }

    private static int toInt32(int lowWord, int highWord) {
        return (highWord & 0xFFFF) << 16 | (lowWord & 0xFFFF);
    }

    private static int[] split(int value) {
        return new int[]{value & 0xFFFF, (value >>> 16) & 0xFFFF};
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return ((Number) value).intValue() != 0;
    }
}
