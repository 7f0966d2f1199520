package cold.spray.client;

import cold.spray.exception.HardwareException;

import java.util.Map;

public interface PlcClient extends HardwareClient {
    /**
     * Пакетное чтение всех тегов ПЛК за один проход
     *
     * @return значения по именам тегов ПЛК
     * @throws HardwareException при ошибке чтения
     */
    Map<String, Object> readAllTags() throws HardwareException;
}
