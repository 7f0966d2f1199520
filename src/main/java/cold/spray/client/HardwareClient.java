package cold.spray.client;

import cold.spray.enums.Device;
import cold.spray.exception.HardwareException;

public interface HardwareClient {
    /**
     * Подключение к оборудованию
     *
     * @throws HardwareException если подключиться не удалось
     */
    void connect() throws HardwareException;

    /**
     * Отключение от оборудования, ошибки отключения только логируются
     */
    void disconnect();

    /**
     * Чтение значения по адресу оборудования
     *
     * @param address адрес оборудования (имя тега ПЛК или P-переменная питателя)
     * @return значение в представлении оборудования
     * @throws HardwareException при ошибке чтения
     */
    Object readTag(String address) throws HardwareException;

    /**
     * Запись значения по адресу оборудования
     *
     * @param address адрес оборудования
     * @param value   значение в представлении оборудования
     * @throws HardwareException при ошибке записи
     */
    void writeTag(String address, Object value) throws HardwareException;

    boolean isConnected();

    Device getDevice();
}
