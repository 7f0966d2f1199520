package cold.spray.client.impl;

import cold.spray.client.HardwareClient;
import cold.spray.configuration.MockConfiguration;
import cold.spray.enums.Device;
import cold.spray.exception.HardwareException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Имитация оборудования на таблице значений в памяти, с задержками и внесением ошибок
 */
public abstract class AbstractMockClient implements HardwareClient {
    private static final Logger logger = LoggerFactory.getLogger(AbstractMockClient.class);
    protected final Map<String, Object> registers = new ConcurrentHashMap<>();
    protected final MockConfiguration configuration;
    private volatile boolean connected;

    protected AbstractMockClient(MockConfiguration configuration, Map<String, Object> initialValues) {
        this.configuration = configuration;
        this.registers.putAll(initialValues);
    }

    @Override
    public void connect() throws HardwareException {
        simulate("connect", null, configuration.getConnectErrorRate());
        connected = true;
        logger.info("Имитация: {} подключен, значений в таблице {}", getDevice().getTemplate(), registers.size());
    }

    @Override
    public void disconnect() {
        connected = false;
        logger.info("Имитация: {} отключен", getDevice().getTemplate());
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Object readTag(String address) throws HardwareException {
        simulate("read", address, configuration.getReadErrorRate());
        Object value = registers.get(address);
        if (value == null) {
            logger.debug("Имитация: адрес {} не задан, отдаем 0", address);
            return 0;
        }
        return value;
    }

    @Override
    public void writeTag(String address, Object value) throws HardwareException {
        simulate("write", address, configuration.getWriteErrorRate());
        registers.put(address, value);
        logger.debug("Имитация: {} = {}", address, value);
    }

    /**
     * Начальное значение для тестов и ручной наладки
     */
    public void seed(String address, Object value) {
        registers.put(address, value);
    }

    public Object getRegister(String address) {
        return registers.get(address);
    }

    protected void simulate(String operation, String address, double errorRate) throws HardwareException {
        Device device = getDevice();
        if (!"connect".equals(operation) && !connected) {
            throw new HardwareException(device, operation, address, "Нет подключения");
        }
        delay(operation, address);
        if (errorRate > 0 && ThreadLocalRandom.current().nextDouble() < errorRate) {
            throw new HardwareException(device, operation, address, "Имитация ошибки оборудования");
        }
    }

    private void delay(String operation, String address) throws HardwareException {
        long delay = configuration.getDelay().toMillis();
        long jitter = configuration.getJitter().toMillis();
        if (jitter > 0) {
            delay += ThreadLocalRandom.current().nextLong(-jitter, jitter + 1);
        }
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(getDevice(), operation, address, "Операция прервана", e);
        }
    }
}
