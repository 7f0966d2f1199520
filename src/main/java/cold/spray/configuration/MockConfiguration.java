package cold.spray.configuration;

import cold.spray.utils.YamlDocuments;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class MockConfiguration {
    @Value("${mock.delay:100ms}")
    private Duration delay;

    @Value("${mock.jitter:20ms}")
    private Duration jitter;

    @Value("${mock.connectErrorRate:0}")
    private Double connectErrorRate;

    @Value("${mock.readErrorRate:0}")
    private Double readErrorRate;

    @Value("${mock.writeErrorRate:0}")
    private Double writeErrorRate;

    @Value("${mock.dataFile:classpath:mock/mock-data.yaml}")
    private String dataFile;

    private final ResourceLoader resourceLoader;

    public MockConfiguration(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public Duration getDelay() {
        return delay;
    }

    public Duration getJitter() {
        return jitter;
    }

    public Double getConnectErrorRate() {
        return connectErrorRate;
    }

    public Double getReadErrorRate() {
        return readErrorRate;
    }

    public Double getWriteErrorRate() {
        return writeErrorRate;
    }

    /**
     * Начальные значения имитации для раздела документа (plc_tags или feeder_vars)
     *
     * @param section раздел документа
     * @return значения по адресам оборудования, пустой словарь если раздела нет
     */
    public Map<String, Object> loadMockData(String section) {
        Object values = YamlDocuments.load(resourceLoader.getResource(dataFile)).get(section);
        if (!(values instanceof Map)) {
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) values).forEach((address, value) -> result.put(address.toString(), value));
        return result;
    }
}
