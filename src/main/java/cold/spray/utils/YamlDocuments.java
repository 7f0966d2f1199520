package cold.spray.utils;

import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

public class YamlDocuments {
    /**
     * Чтение yaml документа, корнем которого должен быть словарь
     *
     * @param resource документ
     * @return содержимое документа
     * @throws IllegalStateException если документ не читается или корень не словарь
     */
    public static Map<String, Object> load(Resource resource) {
        try (InputStream inputStream = resource.getInputStream()) {
            Object loaded = new Yaml().load(inputStream);
            if (!(loaded instanceof Map<?, ?> root)) {
                throw new IllegalStateException("Неверный формат документа " + resource.getDescription()
                        + ", ожидается словарь");
            }
            Map<String, Object> document = new LinkedHashMap<>();
            root.forEach((key, value) -> document.put(String.valueOf(key), value));
            return document;
        } catch (IOException e) {
            throw new IllegalStateException("Не удалось прочитать документ " + resource.getDescription(), e);
        }
    }
}
