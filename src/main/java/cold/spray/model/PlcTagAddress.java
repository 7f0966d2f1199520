package cold.spray.model;

/**
 * Адрес тега ПЛК в пространстве Modbus, получается из выгрузки тегов ПЛК
 */
public class PlcTagAddress {
    private final String name;
    private final Area area;
    private final int offset;
    private final DataType dataType;

    public PlcTagAddress(String name, Area area, int offset, DataType dataType) {
        this.name = name;
        this.area = area;
        this.offset = offset;
        this.dataType = dataType;
    }

    public String getName() {
        return name;
    }

    public Area getArea() {
        return area;
    }

    public int getOffset() {
        return offset;
    }

    public DataType getDataType() {
        return dataType;
    }

    /**
     * Номер последнего занимаемого регистра или катушки
     */
    public int getLastOffset() {
        return offset + dataType.getWidth() - 1;
    }

    public enum Area {
        COIL(0, true, true),
        DISCRETE_INPUT(1, true, false),
        INPUT_REGISTER(3, false, false),
        HOLDING_REGISTER(4, false, true);

        private final int prefix;
        private final boolean bit;
        private final boolean writable;

        Area(int prefix, boolean bit, boolean writable) {
            this.prefix = prefix;
            this.bit = bit;
            this.writable = writable;
        }

        public boolean isBit() {
            return bit;
        }

        public boolean isWritable() {
            return writable;
        }

        /* modbus запрос читает не больше 2000 катушек или 125 регистров */
        public int getMaxBlockSize() {
            return bit ? 2000 : 125;
        }

        public static Area fromPrefix(int prefix) {
            for (Area area : values()) {
                if (area.prefix == prefix) {
                    return area;
                }
            }
            throw new IllegalArgumentException("Неизвестная область адресов modbus: " + prefix);
        }
    }

    public enum DataType {
        BOOLEAN(1),
        INT16(1),
        INT32(2),
        FLOAT32(2);

        private final int width;

        DataType(int width) {
            this.width = width;
        }

        public int getWidth() {
            return width;
        }
    }

    @Override
    public String toString() {
        return name + " " + area + ":" + offset + " " + dataType;
    }
}
