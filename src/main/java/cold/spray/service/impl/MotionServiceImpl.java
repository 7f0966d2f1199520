package cold.spray.service.impl;

import cold.spray.configuration.MotionConfiguration;
import cold.spray.enums.Axis;
import cold.spray.enums.HealthStatus;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.exception.ValidationException;
import cold.spray.model.HealthReport;
import cold.spray.model.Position;
import cold.spray.model.TagValue;
import cold.spray.service.MotionService;
import cold.spray.service.TagCacheService;
import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MotionServiceImpl implements MotionService {
    private static final Logger logger = LoggerFactory.getLogger(MotionServiceImpl.class);
    private static final String XY_MOVE_PREFIX = "motion.motion_control.coordinated_move.xy_move.";
    private static final String XY_TRIGGER_TAG = XY_MOVE_PREFIX + "trigger";
    private static final String XY_PARAMETER_PREFIX = XY_MOVE_PREFIX + "parameters.";
    private static final String SET_HOME_TAG = "motion.motion_control.set_home";
    private static final String MOTION_READY_TAG = "interlocks.motion_ready";
    private static final String ABORTED_PREFIX = "Aborted";
    private final TagCacheService tagCacheService;
    private final MotionConfiguration configuration;

    public MotionServiceImpl(TagCacheService tagCacheService, MotionConfiguration configuration) {
        this.tagCacheService = tagCacheService;
        this.configuration = configuration;
    }

    @Override
    public Position getPosition() throws TagNotCachedException {
        return new Position(getAxisPosition(Axis.X), getAxisPosition(Axis.Y), getAxisPosition(Axis.Z));
    }

    private Double getAxisPosition(Axis axis) throws TagNotCachedException {
        return tagCacheService.getTagWithMetadata(axis.getPositionTag()).asDouble();
    }

    @Override
    public void moveAxis(
            Axis axis,
            double distance,
            double velocity,
            @Nullable Double acceleration,
            @Nullable Double deceleration
    ) throws TagException, HardwareException {
        checkVelocity(axis.getParameterTag("velocity"), velocity);
        if (isMoving(axis)) {
            throw new ValidationException(axis.getTriggerTag(), axis.getTemplate() + " уже в движении");
        }
        double target = getAxisPosition(axis) + distance;
        checkLimits(axis, target);

        logger.info("{} - перемещение на {} мм со скоростью {} мм/с", axis.getTemplate(), distance, velocity);
        tagCacheService.setTag(axis.getParameterTag("distance"), distance);
        tagCacheService.setTag(axis.getParameterTag("velocity"), velocity);
        if (acceleration != null) {
            tagCacheService.setTag(axis.getParameterTag("acceleration"), acceleration);
        }
        if (deceleration != null) {
            tagCacheService.setTag(axis.getParameterTag("deceleration"), deceleration);
        }
        tagCacheService.setTag(axis.getTriggerTag(), true);
    }

    @Override
    public void moveXY(double x, double y, double velocity, @Nullable Double ramps)
            throws TagException, HardwareException {
        checkVelocity(XY_PARAMETER_PREFIX + "velocity", velocity);
        if (isCoordinatedMoveInProgress()) {
            throw new ValidationException(XY_TRIGGER_TAG, "Согласованное перемещение уже выполняется");
        }
        checkLimits(Axis.X, x);
        checkLimits(Axis.Y, y);

        logger.info("Согласованное перемещение в ({}, {}) со скоростью {} мм/с", x, y, velocity);
        tagCacheService.setTag(XY_PARAMETER_PREFIX + "x_position", x);
        tagCacheService.setTag(XY_PARAMETER_PREFIX + "y_position", y);
        tagCacheService.setTag(XY_PARAMETER_PREFIX + "velocity", velocity);
        if (ramps != null) {
            tagCacheService.setTag(XY_PARAMETER_PREFIX + "ramps", ramps);
        }
        tagCacheService.setTag(XY_TRIGGER_TAG, true);
    }

    private void checkVelocity(String tag, double velocity) throws ValidationException {
        if (velocity <= 0) {
            throw new ValidationException(tag, "Скорость должна быть больше нуля, получено " + velocity);
        }
    }

    private void checkLimits(Axis axis, double target) throws ValidationException {
        Pair<Double, Double> limits = configuration.getLimits(axis);
        if (target < limits.getLeft() || target > limits.getRight()) {
            throw new ValidationException(axis.getPositionTag(), axis.getTemplate() + " - точка " + target
                    + " мм вне пределов [" + limits.getLeft() + ", " + limits.getRight() + "]");
        }
    }

    @Override
    public void setHome() throws TagException, HardwareException {
        logger.info("Текущее положение принимается за ноль");
        tagCacheService.setTag(SET_HOME_TAG, true);
    }

    @Override
    public boolean isMoving(Axis axis) throws TagNotCachedException {
        return Boolean.TRUE.equals(tagCacheService.getTagWithMetadata(axis.getInProgressTag()).asBoolean());
    }

    @Override
    public boolean isCoordinatedMoveInProgress() throws TagNotCachedException {
        return Boolean.TRUE.equals(tagCacheService.getTagWithMetadata(XY_PARAMETER_PREFIX + "in_progress").asBoolean());
    }

    @Override
    public List<String> getAxisStatusFlags(Axis axis) throws TagNotCachedException {
        TagValue status = tagCacheService.getTagWithMetadata(axis.getStatusTag());
        Integer word = status.asInteger();
        List<String> flags = new ArrayList<>();
        if (word == null) {
            return flags;
        }
        /* номера битов в описании тега считаются с единицы от младшего */
        status.getDefinition().getBitDefinitions().forEach((bit, name) -> {
            if ((word >> (bit - 1) & 1) == 1) {
                flags.add(name);
            }
        });
        return flags;
    }

    @Override
    public HealthReport getHealth() {
        logger.debug("Проверяем состояние осей");
        Map<String, String> problems = new LinkedHashMap<>();
        HealthStatus status = HealthStatus.OK;
        Instant staleBefore = Instant.now().minus(configuration.getStaleAfter());

        try {
            if (!Boolean.TRUE.equals(tagCacheService.getTagWithMetadata(MOTION_READY_TAG).asBoolean())) {
                problems.put(MOTION_READY_TAG, "контроллер перемещений не готов");
                status = status.worst(HealthStatus.ERROR);
            }
        } catch (TagNotCachedException e) {
            problems.put(MOTION_READY_TAG, "нет данных");
            status = status.worst(HealthStatus.ERROR);
        }

        for (Axis axis : Axis.values()) {
            try {
                TagValue position = tagCacheService.getTagWithMetadata(axis.getPositionTag());
                if (position.getTimestamp().isBefore(staleBefore)) {
                    problems.put(axis.getPositionTag(), "положение не обновлялось");
                    status = status.worst(HealthStatus.DEGRADED);
                }
                List<String> aborted = getAxisStatusFlags(axis).stream()
                        .filter(flag -> flag.startsWith(ABORTED_PREFIX))
                        .toList();
                if (!aborted.isEmpty()) {
                    problems.put(axis.getStatusTag(), String.join(", ", aborted));
                    status = status.worst(HealthStatus.DEGRADED);
                }
            } catch (TagNotCachedException e) {
                problems.put(e.getTag(), "нет данных");
                status = status.worst(HealthStatus.ERROR);
            }
        }
        return new HealthReport("Перемещения", status, problems, Instant.now());
    }
}
