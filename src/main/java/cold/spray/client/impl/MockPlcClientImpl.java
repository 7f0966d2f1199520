package cold.spray.client.impl;

import cold.spray.client.PlcClient;
import cold.spray.configuration.MockConfiguration;
import cold.spray.enums.Device;
import cold.spray.exception.HardwareException;

import java.util.HashMap;
import java.util.Map;

public class MockPlcClientImpl extends AbstractMockClient implements PlcClient {
    public MockPlcClientImpl(MockConfiguration configuration) {
        super(configuration, configuration.loadMockData("plc_tags"));
    }

    @Override
    public Map<String, Object> readAllTags() throws HardwareException {
        simulate("read", null, configuration.getReadErrorRate());
        return new HashMap<>(registers);
    }

    @Override
    public Device getDevice() {
        return Device.PLC;
    }
}
