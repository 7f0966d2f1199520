package cold.spray.service;

import cold.spray.enums.HealthStatus;

public interface HealthService {
    /**
     * Последний рассчитанный статус самодиагностики
     */
    HealthStatus getStatus();

    /**
     * Текущий статус в текстовом виде со списком проблем.
     * Накопленные ошибки не сбрасываются и событие о смене статуса не отправляется
     *
     * @return форматированная строка
     */
    String getFormattedStatus();
}
