package cold.spray.configuration;

import cold.spray.utils.YamlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.Map;

@Configuration
public class TagsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TagsConfiguration.class);

    @Value("${tags.configFile}")
    private String configFile;

    private final ResourceLoader resourceLoader;

    public TagsConfiguration(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Чтение документа конфигурации тегов
     *
     * @return вложенная структура группа - теги
     * @throws IllegalStateException если файл не найден или имеет неверный формат
     */
    public Map<String, Object> loadTagConfig() {
        logger.debug("Читаем конфигурацию тегов из {}", configFile);
        return YamlDocuments.load(resourceLoader.getResource(configFile));
    }
}
