package cold.spray.service;

import cold.spray.enums.Device;
import cold.spray.exception.UnknownTagException;
import cold.spray.model.TagDefinition;
import cold.spray.model.TagMappingTable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface TagMappingService {
    /**
     * Построение таблиц сопоставления из документа конфигурации тегов.
     * Новая таблица публикуется целиком, читатели видят либо старую, либо новую.
     * Теги без адреса оборудования и повторы адресов пропускаются с предупреждением
     *
     * @param tagConfig документ конфигурации тегов
     */
    void buildMappings(Map<String, Object> tagConfig);

    /**
     * Перечитать конфигурацию тегов из файла и перестроить таблицы
     */
    void rebuild();

    /**
     * Адрес оборудования по имени тега
     *
     * @param mappedName имя тега, например gas_control.main_flow.setpoint
     * @return имя тега ПЛК или P-переменная питателя
     * @throws UnknownTagException если тег не сопоставлен с оборудованием
     */
    String toHardwareTag(String mappedName) throws UnknownTagException;

    /**
     * Имя тега по адресу оборудования, поиск по всем устройствам
     *
     * @param hardwareAddress адрес оборудования
     * @return имя тега
     * @throws UnknownTagException если адрес не сопоставлен ни с одним тегом
     */
    String toMappedName(String hardwareAddress) throws UnknownTagException;

    String toMappedName(Device device, String hardwareAddress) throws UnknownTagException;

    /**
     * Описание тега
     *
     * @param mappedName имя тега
     * @return описание тега
     * @throws UnknownTagException если тега нет в таблице
     */
    TagDefinition getTagMetadata(String mappedName) throws UnknownTagException;

    /**
     * Текущий снимок таблиц сопоставления.
     * Операции, которым нужно несколько обращений к таблице, берут один снимок на весь проход
     */
    TagMappingTable getMappingTable();

    boolean isPlcTag(String mappedName);

    boolean isFeederTag(String mappedName);

    /**
     * Описания тегов группы (первый сегмент имени), результат кэшируется до перестроения таблиц
     *
     * @param group группа, например gas_control
     * @return описания тегов группы, пустой список если группы нет
     */
    List<TagDefinition> getTagsInGroup(String group);

    Collection<TagDefinition> getAllDefinitions();
}
