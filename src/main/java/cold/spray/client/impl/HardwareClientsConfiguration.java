package cold.spray.client.impl;

import cold.spray.client.FeederClient;
import cold.spray.client.PlcClient;
import cold.spray.configuration.CommunicationConfiguration;
import cold.spray.configuration.MockConfiguration;
import cold.spray.configuration.PlcConfiguration;
import cold.spray.configuration.SshConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/* Настоящие клиенты или имитация - по флагу communication.forceMock */
@Configuration
public class HardwareClientsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(HardwareClientsConfiguration.class);

    @Bean
    public PlcClient plcClient(
            CommunicationConfiguration communicationConfiguration,
            PlcConfiguration plcConfiguration,
            MockConfiguration mockConfiguration,
            ResourceLoader resourceLoader
    ) {
        if (communicationConfiguration.getForceMock()) {
            logger.info("Используется имитация ПЛК");
            return new MockPlcClientImpl(mockConfiguration);
        }
        return new ModbusPlcClientImpl(plcConfiguration, resourceLoader);
    }

    @Bean
    public FeederClient feederClient(
            CommunicationConfiguration communicationConfiguration,
            SshConfiguration sshConfiguration,
            MockConfiguration mockConfiguration
    ) {
        if (communicationConfiguration.getForceMock()) {
            logger.info("Используется имитация контроллера питателя");
            return new MockFeederClientImpl(mockConfiguration);
        }
        return new SshFeederClientImpl(sshConfiguration);
    }
}
