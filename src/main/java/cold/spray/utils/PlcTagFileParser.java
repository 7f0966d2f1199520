package cold.spray.utils;

import cold.spray.model.PlcTagAddress;
import cold.spray.model.PlcTagAddress.Area;
import cold.spray.model.PlcTagAddress.DataType;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/* Разбор выгрузки тегов ПЛК (csv из среды программирования Productivity) */
public class PlcTagFileParser {
    private static final Logger logger = LoggerFactory.getLogger(PlcTagFileParser.class);
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    private static final String NAME_COLUMN = "tag name";
    private static final String TYPE_COLUMN = "tag type";
    private static final String DATA_TYPE_COLUMN = "data type";
    private static final String ADDRESS_COLUMN = "modbus start address";

    public static Map<String, PlcTagAddress> parse(InputStream inputStream) throws IOException {
        Map<String, PlcTagAddress> result = new LinkedHashMap<>();
        Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8);
        try (MappingIterator<String[]> rows = CSV_MAPPER.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNext()) {
                return result;
            }
            String[] header = rows.next();
            List<String> columns = Arrays.stream(header).map(column -> column.toLowerCase(Locale.ROOT)).toList();
            int nameIndex = columns.indexOf(NAME_COLUMN);
            int typeIndex = columns.contains(TYPE_COLUMN) ? columns.indexOf(TYPE_COLUMN) : columns.indexOf(DATA_TYPE_COLUMN);
            int addressIndex = columns.indexOf(ADDRESS_COLUMN);
            if (nameIndex < 0 || typeIndex < 0 || addressIndex < 0) {
                throw new IOException("В выгрузке тегов ПЛК нет обязательных колонок: " + String.join(",", header));
            }

            while (rows.hasNext()) {
                String[] cells = rows.next();
                if (cells.length <= Math.max(nameIndex, Math.max(typeIndex, addressIndex))) {
                    logger.debug("Пропускаем неполную строку выгрузки тегов: {}", Arrays.toString(cells));
                    continue;
                }
                String name = cells[nameIndex];
                String address = cells[addressIndex];
                if (StringUtils.isAnyBlank(name, address)) {
                    logger.debug("Тег {} не имеет modbus адреса, пропускаем", name);
                    continue;
                }
                PlcTagAddress tagAddress = toAddress(name, cells[typeIndex], address);
                if (tagAddress != null) {
                    result.put(name, tagAddress);
                }
            }
        }
        logger.info("Из выгрузки тегов ПЛК прочитано {} тегов", result.size());
        return result;
    }

    private static PlcTagAddress toAddress(String name, String type, String address) {
        int numeric;
        try {
            numeric = Integer.parseInt(address.trim());
        } catch (NumberFormatException e) {
            logger.warn("Неверный modbus адрес {} у тега {}, пропускаем", address, name);
            return null;
        }
        Area area = Area.fromPrefix(numeric / 100000);
        int offset = numeric % 100000 - 1;

        DataType dataType;
        String lowerType = type.toLowerCase(Locale.ROOT);
        if (area.isBit()) {
            dataType = DataType.BOOLEAN;
        } else if (lowerType.contains("float")) {
            dataType = DataType.FLOAT32;
        } else if (lowerType.contains("32")) {
            dataType = DataType.INT32;
        } else if (lowerType.contains("16") || lowerType.contains("integer")) {
            dataType = DataType.INT16;
        } else {
            logger.debug("Тип {} тега {} не поддерживается, пропускаем", type, name);
            return null;
        }
        return new PlcTagAddress(name, area, offset, dataType);
    }
}
