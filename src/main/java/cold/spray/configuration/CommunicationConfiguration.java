package cold.spray.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CommunicationConfiguration {
    @Value("${communication.forceMock:true}")
    private Boolean forceMock;

    @Value("${tagCache.pollInterval:${plc.pollingInterval:1s}}")
    private Duration pollInterval;

    public Boolean getForceMock() {
        return forceMock;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
