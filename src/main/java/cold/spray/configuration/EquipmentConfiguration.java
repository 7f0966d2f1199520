package cold.spray.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EquipmentConfiguration {
    @Value("${equipment.flowTolerancePercent:5}")
    private Float flowTolerancePercent;

    @Value("${equipment.staleAfter:5s}")
    private Duration staleAfter;

    @Value("${equipment.feederFrequencyStep:200}")
    private Integer feederFrequencyStep;

    @Value("${equipment.feederRunTime:999}")
    private Integer feederRunTime;

    @Value("${equipment.feederStartValue:1}")
    private Integer feederStartValue;

    @Value("${equipment.feederStopValue:4}")
    private Integer feederStopValue;

    public Float getFlowTolerancePercent() {
        return flowTolerancePercent;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public Integer getFeederFrequencyStep() {
        return feederFrequencyStep;
    }

    public Integer getFeederRunTime() {
        return feederRunTime;
    }

    public Integer getFeederStartValue() {
        return feederStartValue;
    }

    public Integer getFeederStopValue() {
        return feederStopValue;
    }
}
