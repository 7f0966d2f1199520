package cold.spray.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfiguration {
    @Value("${health.pollErrorsToEmergency:3}")
    private Integer pollErrorsToEmergency;

    public Integer getPollErrorsToEmergency() {
        return pollErrorsToEmergency;
    }
}
