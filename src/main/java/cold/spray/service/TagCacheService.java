package cold.spray.service;

import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.exception.UnknownTagException;
import cold.spray.exception.ValidationException;
import cold.spray.model.TagValue;

import java.time.Instant;
import java.util.Map;

public interface TagCacheService {
    /**
     * Перестроение таблиц сопоставления тегов, опрос при этом не запускается
     */
    void initialize();

    /**
     * Запуск фонового опроса ПЛК. Повторный запуск ничего не делает
     */
    void start();

    /**
     * Остановка опроса с ожиданием текущего прохода. Кэш не очищается
     */
    void stop();

    boolean isRunning();

    /**
     * Время инициализации кэша, значения тегов всегда новее него
     */
    Instant getInitializedAt();

    void clearCache();

    /**
     * Текущее значение тега в инженерных единицах
     *
     * @param tag имя тега
     * @return значение из кэша
     * @throws TagNotCachedException если значение еще ни разу не было получено
     */
    Object getTag(String tag) throws TagNotCachedException;

    /**
     * Значение тега вместе с описанием и временем обновления
     *
     * @param tag имя тега
     * @return значение тега
     * @throws TagNotCachedException если значение еще ни разу не было получено
     */
    TagValue getTagWithMetadata(String tag) throws TagNotCachedException;

    /**
     * Снимок всех значений, копия
     */
    Map<String, TagValue> getAllTags();

    /**
     * Снимок значений одной группы тегов
     *
     * @param group группа, например motion
     * @return копия значений группы
     */
    Map<String, TagValue> getGroupTags(String group);

    /**
     * Запись значения тега: проверка, перевод в представление оборудования, запись, обновление кэша.
     * Если запись в оборудование не прошла, кэш не меняется
     *
     * @param tag   имя тега
     * @param value инженерное значение
     * @throws UnknownTagException если тег неизвестен
     * @throws ValidationException если значение не проходит проверку
     * @throws HardwareException   если запись в оборудование не удалась
     */
    void setTag(String tag, Object value) throws TagException, HardwareException;

    /**
     * Проверка значения перед записью: доступ, тип, диапазон, варианты, скорости.
     * Для внутренних тегов проверка не выполняется
     *
     * @param tag   имя тега
     * @param value инженерное значение
     * @throws UnknownTagException если тег неизвестен
     * @throws ValidationException с описанием нарушенного ограничения
     */
    void validateValue(String tag, Object value) throws TagException;

    void addStateCallback(TagStateCallback callback);

    void removeStateCallback(TagStateCallback callback);
}
