package cold.spray.service;

import cold.spray.enums.GasLine;
import cold.spray.enums.GateValvePosition;
import cold.spray.enums.VacuumPump;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.model.HealthReport;

public interface EquipmentService {
    /**
     * Уставка расхода основного газа
     *
     * @param flow расход, SLPM
     */
    void setMainFlow(double flow) throws TagException, HardwareException;

    /**
     * Уставка расхода газа питателя
     *
     * @param flow расход, SLPM
     */
    void setFeederFlow(double flow) throws TagException, HardwareException;

    void setGasValve(GasLine line, boolean open) throws TagException, HardwareException;

    void setVentValve(boolean open) throws TagException, HardwareException;

    /**
     * Положение шибера задается двумя дискретными выходами: открыт и приоткрыт
     */
    void setGateValve(GateValvePosition position) throws TagException, HardwareException;

    void setShutter(boolean engaged) throws TagException, HardwareException;

    /**
     * Выбор активного сопла
     *
     * @param nozzleId номер сопла, 1 или 2
     */
    void selectNozzle(int nozzleId) throws TagException, HardwareException;

    /**
     * Частота питателя, должна быть кратна шагу частоты
     *
     * @param feederId  номер питателя, 1 или 2
     * @param frequency частота, Гц
     */
    void setFeederFrequency(int feederId, int frequency) throws TagException, HardwareException;

    /**
     * Запуск питателя: сначала время работы, затем команда пуска
     *
     * @param feederId номер питателя, 1 или 2
     */
    void startFeeder(int feederId) throws TagException, HardwareException;

    void stopFeeder(int feederId) throws TagException, HardwareException;

    /**
     * Скорость деагломератора по имени (high, med, low, off)
     *
     * @param deagglomeratorId номер деагломератора, 1 или 2
     * @param speed            имя скорости
     */
    void setDeagglomeratorSpeed(int deagglomeratorId, String speed) throws TagException, HardwareException;

    void setDeagglomeratorFrequency(int deagglomeratorId, int frequency) throws TagException, HardwareException;

    void startPump(VacuumPump pump) throws TagException, HardwareException;

    void stopPump(VacuumPump pump) throws TagException, HardwareException;

    /**
     * Состояние оборудования по значениям из кэша, без обращения к оборудованию
     *
     * @return отчет с найденными проблемами
     */
    HealthReport getHealth();
}
