package cold.spray.service;

/**
 * Подписка на изменение значения тега в кэше
 */
@FunctionalInterface
public interface TagStateCallback {
    /**
     * @param tag      имя тега
     * @param oldValue прошлое значение, null если значения еще не было
     * @param newValue новое значение
     */
    void onTagChanged(String tag, Object oldValue, Object newValue);
}
