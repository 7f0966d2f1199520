package cold.spray.client.impl;

import cold.spray.client.PlcClient;
import cold.spray.configuration.PlcConfiguration;
import cold.spray.enums.Device;
import cold.spray.exception.HardwareException;
import cold.spray.model.PlcTagAddress;
import cold.spray.model.PlcTagAddress.Area;
import cold.spray.utils.PlcRegisters;
import cold.spray.utils.PlcTagFileParser;
import com.intelligt.modbus.jlibmodbus.Modbus;
import com.intelligt.modbus.jlibmodbus.exception.ModbusIOException;
import com.intelligt.modbus.jlibmodbus.master.ModbusMaster;
import com.intelligt.modbus.jlibmodbus.master.ModbusMasterFactory;
import com.intelligt.modbus.jlibmodbus.tcp.TcpParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * ПЛК по Modbus TCP. Адреса тегов берутся из выгрузки тегов ПЛК.
 * Любое чтение - это чтение всей таблицы тегов блоками, поэтому значения кэшируются уровнем выше
 */
public class ModbusPlcClientImpl implements PlcClient {
    private static final Logger logger = LoggerFactory.getLogger(ModbusPlcClientImpl.class);
    private final PlcConfiguration configuration;
    private final ResourceLoader resourceLoader;
    private final ExecutorService executorService = Executors.newSingleThreadExecutor();
    private volatile ModbusMaster modbusMaster;
    private volatile Map<String, PlcTagAddress> tagAddresses = Collections.emptyMap();
    private volatile Set<String> knownTags = Collections.emptySet();

    public ModbusPlcClientImpl(PlcConfiguration configuration, ResourceLoader resourceLoader) {
        this.configuration = configuration;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public void connect() throws HardwareException {
        try (InputStream tagFile = resourceLoader.getResource(configuration.getTagFile()).getInputStream()) {
            tagAddresses = PlcTagFileParser.parse(tagFile);

            TcpParameters tcpParameters = new TcpParameters();
            tcpParameters.setHost(InetAddress.getByName(configuration.getIp()));
            tcpParameters.setKeepAlive(true);
            tcpParameters.setPort(configuration.getPort());

            ModbusMaster master = ModbusMasterFactory.createModbusMasterTCP(tcpParameters);
            master.setResponseTimeout((int) configuration.getTimeout().toMillis());
            Modbus.setAutoIncrementTransactionId(true);
            master.connect();
            modbusMaster = master;
        } catch (Exception e) {
            logger.error("Ошибка подключения к ПЛК {}", configuration.getIp(), e);
            throw new HardwareException(Device.PLC, "connect", configuration.getIp(), "Ошибка подключения к ПЛК", e);
        }

        knownTags = Set.copyOf(readAllTags().keySet());
        logger.info("Подключились к ПЛК {}, доступно тегов: {}", configuration.getIp(), knownTags.size());
    }

    @Override
    public void disconnect() {
        ModbusMaster master = modbusMaster;
        modbusMaster = null;
        if (master == null) {
            return;
        }
        try {
            master.disconnect();
            logger.info("Отключились от ПЛК {}", configuration.getIp());
        } catch (ModbusIOException e) {
            logger.warn("Ошибка при отключении от ПЛК, соединение брошено", e);
        }
    }

    @Override
    public boolean isConnected() {
        ModbusMaster master = modbusMaster;
        return master != null && master.isConnected();
    }

    @Override
    public Map<String, Object> readAllTags() throws HardwareException {
        ModbusMaster master = requireMaster("read", null);
        try {
            Future<Map<String, Object>> future = executorService.submit(() -> readBlocks(master));
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Ошибка пакетного чтения тегов ПЛК", e.getCause());
            throw new HardwareException(Device.PLC, "read", null, "Ошибка пакетного чтения тегов", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(Device.PLC, "read", null, "Чтение тегов прервано", e);
        }
    }

    @Override
    public Object readTag(String address) throws HardwareException {
        if (!knownTags.isEmpty() && !knownTags.contains(address)) {
            throw new HardwareException(Device.PLC, "read", address, "Тег не найден в ПЛК при подключении");
        }
        Map<String, Object> values = readAllTags();
        if (!values.containsKey(address)) {
            throw new HardwareException(Device.PLC, "read", address, "Тег отсутствует в ответе ПЛК");
        }
        return values.get(address);
    }

    @Override
    public void writeTag(String address, Object value) throws HardwareException {
        ModbusMaster master = requireMaster("write", address);
        PlcTagAddress tagAddress = tagAddresses.get(address);
        if (tagAddress == null) {
            throw new HardwareException(Device.PLC, "write", address, "Тег отсутствует в выгрузке тегов ПЛК");
        }
        if (!tagAddress.getArea().isWritable()) {
            throw new HardwareException(Device.PLC, "write", address,
                    "Область " + tagAddress.getArea() + " доступна только для чтения");
        }

        try {
            Future<Boolean> future = executorService.submit(() -> writeAddress(master, tagAddress, value));
            /* этот future.get нужен только чтобы получить ExecutionException и по нему понять, что запись не прошла */
            future.get();
            logger.debug("Записали в ПЛК {} = {}", address, value);
        } catch (ExecutionException e) {
            logger.error("Ошибка записи тега ПЛК {}", address, e.getCause());
            throw new HardwareException(Device.PLC, "write", address, "Ошибка записи", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(Device.PLC, "write", address, "Запись прервана", e);
        }
    }

    @Override
    public Device getDevice() {
        return Device.PLC;
    }

    private ModbusMaster requireMaster(String operation, String address) throws HardwareException {
        ModbusMaster master = modbusMaster;
        if (master == null) {
            throw new HardwareException(Device.PLC, operation, address, "Нет подключения к ПЛК");
        }
        return master;
    }

    private Map<String, Object> readBlocks(ModbusMaster master) throws Exception {
        Map<String, Object> result = new HashMap<>();
        int unitId = configuration.getUnitId();
        for (Area area : Area.values()) {
            List<PlcTagAddress> addresses = new ArrayList<>();
            tagAddresses.values().stream().filter(address -> address.getArea() == area).forEach(addresses::add);
            addresses.sort(Comparator.comparingInt(PlcTagAddress::getOffset));

            for (List<PlcTagAddress> block : toBlocks(addresses, area.getMaxBlockSize())) {
                int start = block.get(0).getOffset();
                int quantity = block.stream().mapToInt(PlcTagAddress::getLastOffset).max().orElse(start) - start + 1;
                if (area.isBit()) {
                    boolean[] bits = area == Area.COIL
                            ? master.readCoils(unitId, start, quantity)
                            : master.readDiscreteInputs(unitId, start, quantity);
                    block.forEach(address -> result.put(address.getName(), bits[address.getOffset() - start]));
                } else {
                    int[] registers = area == Area.HOLDING_REGISTER
                            ? master.readHoldingRegisters(unitId, start, quantity)
                            : master.readInputRegisters(unitId, start, quantity);
                    block.forEach(address -> result.put(
                            address.getName(),
                            PlcRegisters.decode(address.getDataType(), registers, address.getOffset() - start)
                    ));
                }
            }
        }
        logger.trace("Прочитано тегов ПЛК: {}", result.size());
        return result;
    }

    /* соседние адреса объединяются в блок, пока он помещается в один modbus запрос */
    static List<List<PlcTagAddress>> toBlocks(List<PlcTagAddress> sortedAddresses, int maxBlockSize) {
        List<List<PlcTagAddress>> blocks = new ArrayList<>();
        List<PlcTagAddress> current = new ArrayList<>();
        int start = 0;
        for (PlcTagAddress address : sortedAddresses) {
            if (!current.isEmpty() && address.getLastOffset() - start + 1 > maxBlockSize) {
                blocks.add(current);
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                start = address.getOffset();
            }
            current.add(address);
        }
        if (!current.isEmpty()) {
            blocks.add(current);
        }
        return blocks;
    }

    private Boolean writeAddress(ModbusMaster master, PlcTagAddress address, Object value) throws Exception {
        int unitId = configuration.getUnitId();
        if (address.getArea() == Area.COIL) {
            boolean flag = value instanceof Boolean ? (Boolean) value : ((Number) value).intValue() != 0;
            master.writeSingleCoil(unitId, address.getOffset(), flag);
            return true;
        }
        int[] words = PlcRegisters.encode(address.getDataType(), value);
        if (words.length == 1) {
            master.writeSingleRegister(unitId, address.getOffset(), words[0]);
        } else {
            master.writeMultipleRegisters(unitId, address.getOffset(), words);
        }
        return true;
    }
}
