package cold.spray.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class PlcConfiguration {
    @Value("${plc.ip}")
    private String ip;

    @Value("${plc.port:502}")
    private Integer port;

    @Value("${plc.unitId:1}")
    private Integer unitId;

    @Value("${plc.tagFile}")
    private String tagFile;

    @Value("${plc.timeout:5s}")
    private Duration timeout;

    public String getIp() {
        return ip;
    }

    public Integer getPort() {
        return port;
    }

    public Integer getUnitId() {
        return unitId;
    }

    public String getTagFile() {
        return tagFile;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
