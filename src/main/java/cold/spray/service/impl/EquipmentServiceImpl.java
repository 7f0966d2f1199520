package cold.spray.service.impl;

import cold.spray.configuration.EquipmentConfiguration;
import cold.spray.enums.GasLine;
import cold.spray.enums.GateValvePosition;
import cold.spray.enums.HealthStatus;
import cold.spray.enums.VacuumPump;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.exception.ValidationException;
import cold.spray.model.HealthReport;
import cold.spray.model.TagValue;
import cold.spray.service.EquipmentService;
import cold.spray.service.TagCacheService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class EquipmentServiceImpl implements EquipmentService {
    private static final Logger logger = LoggerFactory.getLogger(EquipmentServiceImpl.class);
    private static final String HARDWARE_SET_PREFIX = "gas_control.hardware_sets.set";
    private static final String VENT_TAG = "valve_control.vent";
    private static final String GATE_VALVE_OPEN_TAG = "valve_control.gate_valve.open";
    private static final String GATE_VALVE_PARTIAL_TAG = "valve_control.gate_valve.partial";
    private static final String SHUTTER_TAG = "relay_control.shutter";
    private static final String NOZZLE_SELECT_TAG = "gas_control.hardware_sets.nozzle_select";
    private final TagCacheService tagCacheService;
    private final EquipmentConfiguration configuration;

    public EquipmentServiceImpl(
            TagCacheService tagCacheService,
            EquipmentConfiguration configuration,
            MeterRegistry meterRegistry
    ) {
        this.tagCacheService = tagCacheService;
        this.configuration = configuration;

        for (GasLine line : GasLine.values()) {
            Gauge.builder("gas_flow", () -> getMeasuredFlow(line))
                    .tag("system", "cold_spray")
                    .tag("component", line.name())
                    .description(line.getTemplate())
                    .register(meterRegistry);
        }
    }

    @Override
    public void setMainFlow(double flow) throws TagException, HardwareException {
        setFlow(GasLine.MAIN, flow);
    }

    @Override
    public void setFeederFlow(double flow) throws TagException, HardwareException {
        setFlow(GasLine.FEEDER, flow);
    }

    private void setFlow(GasLine line, double flow) throws TagException, HardwareException {
        logger.info("{} - уставка расхода {} SLPM", line.getTemplate(), flow);
        tagCacheService.setTag(line.getSetpointTag(), flow);
    }

    @Override
    public void setGasValve(GasLine line, boolean open) throws TagException, HardwareException {
        logger.info("{} - {} клапан", line.getTemplate(), open ? "открываем" : "закрываем");
        tagCacheService.setTag(line.getValveTag(), open);
    }

    @Override
    public void setVentValve(boolean open) throws TagException, HardwareException {
        logger.info("Клапан напуска камеры - {}", open ? "открываем" : "закрываем");
        tagCacheService.setTag(VENT_TAG, open);
    }

    @Override
    public void setGateValve(GateValvePosition position) throws TagException, HardwareException {
        logger.info("Шибер - {}", position.getTemplate());
        /* сначала снимаем лишний выход, чтобы оба не были включены одновременно */
        if (position.isOpen()) {
            tagCacheService.setTag(GATE_VALVE_PARTIAL_TAG, false);
            tagCacheService.setTag(GATE_VALVE_OPEN_TAG, true);
        } else {
            tagCacheService.setTag(GATE_VALVE_OPEN_TAG, false);
            tagCacheService.setTag(GATE_VALVE_PARTIAL_TAG, position.isPartial());
        }
    }

    @Override
    public void setShutter(boolean engaged) throws TagException, HardwareException {
        logger.info("Заслонка сопла - {}", engaged ? "закрываем" : "открываем");
        tagCacheService.setTag(SHUTTER_TAG, engaged);
    }

    @Override
    public void selectNozzle(int nozzleId) throws TagException, HardwareException {
        checkId(NOZZLE_SELECT_TAG, nozzleId, "сопла");
        logger.info("Выбираем сопло {}", nozzleId);
        tagCacheService.setTag(NOZZLE_SELECT_TAG, nozzleId == 2);
    }

    @Override
    public void setFeederFrequency(int feederId, int frequency) throws TagException, HardwareException {
        String tag = getFeederTag(feederId, "frequency");
        int step = configuration.getFeederFrequencyStep();
        if (frequency % step != 0) {
            throw new ValidationException(tag, "Частота питателя " + frequency + " Гц должна быть кратна " + step);
        }
        logger.info("Питатель {} - частота {} Гц", feederId, frequency);
        tagCacheService.setTag(tag, frequency);
    }

    @Override
    public void startFeeder(int feederId) throws TagException, HardwareException {
        String runTimeTag = getFeederTag(feederId, "run_time");
        logger.info("Запускаем питатель {}", feederId);
        tagCacheService.setTag(runTimeTag, configuration.getFeederRunTime());
        tagCacheService.setTag(getFeederTag(feederId, "command"), configuration.getFeederStartValue());
    }

    @Override
    public void stopFeeder(int feederId) throws TagException, HardwareException {
        String commandTag = getFeederTag(feederId, "command");
        logger.info("Останавливаем питатель {}", feederId);
        tagCacheService.setTag(commandTag, configuration.getFeederStopValue());
    }

    private String getFeederTag(int feederId, String parameter) throws ValidationException {
        String tag = HARDWARE_SET_PREFIX + feederId + ".feeder." + parameter;
        checkId(tag, feederId, "питателя");
        return tag;
    }

    @Override
    public void setDeagglomeratorSpeed(int deagglomeratorId, String speed) throws TagException, HardwareException {
        String tag = getDeagglomeratorTag(deagglomeratorId, "duty_cycle");
        logger.info("Деагломератор {} - скорость {}", deagglomeratorId, speed);
        tagCacheService.setTag(tag, speed);
    }

    @Override
    public void setDeagglomeratorFrequency(int deagglomeratorId, int frequency)
            throws TagException, HardwareException {
        String tag = getDeagglomeratorTag(deagglomeratorId, "frequency");
        logger.info("Деагломератор {} - частота ШИМ {} Гц", deagglomeratorId, frequency);
        tagCacheService.setTag(tag, frequency);
    }

    private String getDeagglomeratorTag(int deagglomeratorId, String parameter) throws ValidationException {
        String tag = HARDWARE_SET_PREFIX + deagglomeratorId + ".deagglomerator." + parameter;
        checkId(tag, deagglomeratorId, "деагломератора");
        return tag;
    }

    private void checkId(String tag, int id, String template) throws ValidationException {
        if (id != 1 && id != 2) {
            throw new ValidationException(tag, "Неверный номер " + template + ": " + id + ", допустимы 1 и 2");
        }
    }

    @Override
    public void startPump(VacuumPump pump) throws TagException, HardwareException {
        logger.info("Запускаем {}", pump.getTemplate());
        tagCacheService.setTag(pump.getStartTag(), true);
    }

    @Override
    public void stopPump(VacuumPump pump) throws TagException, HardwareException {
        logger.info("Останавливаем {}", pump.getTemplate());
        tagCacheService.setTag(pump.getStopTag(), true);
    }

    @Override
    public HealthReport getHealth() {
        logger.debug("Проверяем состояние оборудования");
        Map<String, String> problems = new LinkedHashMap<>();
        HealthStatus status = HealthStatus.OK;
        Instant staleBefore = Instant.now().minus(configuration.getStaleAfter());

        for (GasLine line : GasLine.values()) {
            TagValue valve;
            TagValue setpoint;
            TagValue measured;
            try {
                valve = tagCacheService.getTagWithMetadata(line.getValveTag());
                setpoint = tagCacheService.getTagWithMetadata(line.getSetpointTag());
                measured = tagCacheService.getTagWithMetadata(line.getMeasuredTag());
            } catch (TagNotCachedException e) {
                problems.put(e.getTag(), "нет данных");
                status = status.worst(HealthStatus.ERROR);
                continue;
            }

            if (measured.getTimestamp().isBefore(staleBefore)) {
                problems.put(line.getMeasuredTag(), "данные устарели на "
                        + Duration.between(measured.getTimestamp(), Instant.now()).toSeconds() + " с");
                status = status.worst(HealthStatus.DEGRADED);
            }

            if (!Boolean.TRUE.equals(valve.asBoolean()) || setpoint.asDouble() == null || setpoint.asDouble() <= 0) {
                continue;
            }
            double deviation = Math.abs(measured.asDouble() - setpoint.asDouble()) / setpoint.asDouble() * 100;
            if (deviation > configuration.getFlowTolerancePercent()) {
                logger.warn("{} - расход {} отличается от уставки {} на {}%",
                        line.getTemplate(), measured.asDouble(), setpoint.asDouble(), Math.round(deviation));
                problems.put(line.getMeasuredTag(), "расход " + measured.asDouble() + " при уставке "
                        + setpoint.asDouble());
                status = status.worst(HealthStatus.DEGRADED);
            }
        }
        return new HealthReport("Оборудование", status, problems, Instant.now());
    }

    @Nullable
    private Double getMeasuredFlow(GasLine line) {
        try {
            return tagCacheService.getTagWithMetadata(line.getMeasuredTag()).asDouble();
        } catch (TagNotCachedException e) {
            return null;
        }
    }
}
