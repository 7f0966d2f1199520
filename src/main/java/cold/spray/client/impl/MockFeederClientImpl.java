package cold.spray.client.impl;

import cold.spray.client.FeederClient;
import cold.spray.configuration.MockConfiguration;
import cold.spray.enums.Device;
import cold.spray.exception.HardwareException;
import cold.spray.utils.FeederLineProtocol;

/* Значения проходят через текстовое представление, как по настоящей оболочке */
public class MockFeederClientImpl extends AbstractMockClient implements FeederClient {

    public MockFeederClientImpl(MockConfiguration configuration) {
        super(configuration, configuration.loadMockData("feeder_vars"));
    }

    @Override
    public void writeTag(String address, Object value) throws HardwareException {
        super.writeTag(address, FeederLineProtocol.parseValue(FeederLineProtocol.formatValue(value)));
    }

    @Override
    public Device getDevice() {
        return Device.FEEDER;
    }
}
