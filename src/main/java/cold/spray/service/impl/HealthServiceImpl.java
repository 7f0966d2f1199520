package cold.spray.service.impl;

import cold.spray.configuration.HealthConfiguration;
import cold.spray.enums.HealthStatus;
import cold.spray.event.error.FeederErrorEvent;
import cold.spray.event.error.PlcPollErrorEvent;
import cold.spray.event.error.TagWriteErrorEvent;
import cold.spray.event.info.HealthStatusChangedEvent;
import cold.spray.model.HealthReport;
import cold.spray.service.EquipmentService;
import cold.spray.service.HealthService;
import cold.spray.service.MotionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class HealthServiceImpl implements HealthService {
    private static final Logger logger = LoggerFactory.getLogger(HealthServiceImpl.class);
    private final EquipmentService equipmentService;
    private final MotionService motionService;
    private final HealthConfiguration configuration;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final List<PlcPollErrorEvent> plcPollErrorEvents = new ArrayList<>();
    private final List<FeederErrorEvent> feederErrorEvents = new ArrayList<>();
    private final Set<String> tagWriteErrors = new LinkedHashSet<>();
    private HealthStatus lastStatus = HealthStatus.OK;
    private String lastReport = "";

    public HealthServiceImpl(
            EquipmentService equipmentService,
            MotionService motionService,
            HealthConfiguration configuration,
            ApplicationEventPublisher applicationEventPublisher
    ) {
        this.equipmentService = equipmentService;
        this.motionService = motionService;
        this.configuration = configuration;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Scheduled(fixedRateString = "${health.controlInterval}", initialDelayString = "${health.initialDelay:0}")
    private void control() {
        calculateHealthStatus();
    }

    private synchronized void calculateHealthStatus() {
        logger.debug("Запущена задача самодиагностики");
        HealthReport equipment = equipmentService.getHealth();
        HealthReport motion = motionService.getHealth();
        HealthStatus newStatus = evaluate(equipment, motion);
        lastReport = format(newStatus, equipment, motion);
        notifyAndSetLastStatus(newStatus);
        clear();
    }

    /* только расчет, накопленные ошибки сбрасывает плановая проверка */
    private HealthStatus evaluate(HealthReport equipment, HealthReport motion) {
        HealthStatus status = equipment.getStatus().worst(motion.getStatus());
        if (!plcPollErrorEvents.isEmpty()) {
            status = status.worst(plcPollErrorEvents.size() >= configuration.getPollErrorsToEmergency()
                    ? HealthStatus.ERROR
                    : HealthStatus.DEGRADED);
        }
        if (!feederErrorEvents.isEmpty() || !tagWriteErrors.isEmpty()) {
            status = status.worst(HealthStatus.DEGRADED);
        }
        return status;
    }

    private void notifyAndSetLastStatus(HealthStatus newStatus) {
        if (newStatus == lastStatus) {
            return;
        }
        if (newStatus == HealthStatus.OK) {
            logger.info("Ситуация нормализована");
        } else if (newStatus == HealthStatus.DEGRADED) {
            logger.warn(lastReport);
        } else {
            logger.error(lastReport);
        }
        logger.debug("Отправляем событие о смене статуса самодиагностики");
        applicationEventPublisher.publishEvent(new HealthStatusChangedEvent(this, lastStatus, newStatus));
        lastStatus = newStatus;
    }

    @EventListener
    public synchronized void onPlcPollErrorEvent(PlcPollErrorEvent event) {
        plcPollErrorEvents.add(event);
    }

    @EventListener
    public synchronized void onFeederErrorEvent(FeederErrorEvent event) {
        feederErrorEvents.add(event);
    }

    @EventListener
    public synchronized void onTagWriteErrorEvent(TagWriteErrorEvent event) {
        tagWriteErrors.add(event.getTag());
    }

    @Override
    public synchronized HealthStatus getStatus() {
        return lastStatus;
    }

    @Override
    public synchronized String getFormattedStatus() {
        HealthReport equipment = equipmentService.getHealth();
        HealthReport motion = motionService.getHealth();
        return format(evaluate(equipment, motion), equipment, motion);
    }

    private String format(HealthStatus status, HealthReport equipment, HealthReport motion) {
        StringBuilder message = new StringBuilder("Самодиагностика - " + status.getTemplate() + "\n");
        message.append(equipment.getFormatted()).append("\n");
        message.append(motion.getFormatted()).append("\n");
        if (!plcPollErrorEvents.isEmpty()) {
            message.append("* ошибок опроса ПЛК: ").append(plcPollErrorEvents.size()).append("\n");
        }
        if (!feederErrorEvents.isEmpty()) {
            message.append("* ошибки контроллера питателя: ");
            message.append(feederErrorEvents.stream().map(FeederErrorEvent::getReason)
                    .collect(Collectors.joining(", ")));
            message.append("\n");
        }
        if (!tagWriteErrors.isEmpty()) {
            message.append("* не удалась запись тегов: ").append(String.join(", ", tagWriteErrors)).append("\n");
        }
        return message.toString();
    }

    private void clear() {
        plcPollErrorEvents.clear();
        feederErrorEvents.clear();
        tagWriteErrors.clear();
    }
}
