package cold.spray.service;

import cold.spray.enums.Axis;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.model.HealthReport;
import cold.spray.model.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public interface MotionService {
    /**
     * Текущее положение по всем осям из кэша
     *
     * @return положение, мм
     * @throws TagNotCachedException если положение еще не опрошено
     */
    Position getPosition() throws TagNotCachedException;

    /**
     * Относительное перемещение по оси. Конечная точка проверяется на программные пределы
     *
     * @param axis         ось
     * @param distance     перемещение, мм, со знаком
     * @param velocity     скорость, мм/с, больше нуля
     * @param acceleration ускорение, если null - остается прежним
     * @param deceleration замедление, если null - остается прежним
     */
    void moveAxis(
            Axis axis,
            double distance,
            double velocity,
            @Nullable Double acceleration,
            @Nullable Double deceleration
    ) throws TagException, HardwareException;

    /**
     * Согласованное перемещение по XY в абсолютные координаты
     *
     * @param x        координата X, мм
     * @param y        координата Y, мм
     * @param velocity линейная скорость, мм/с
     * @param ramps    время разгона, с, если null - остается прежним
     */
    void moveXY(double x, double y, double velocity, @Nullable Double ramps) throws TagException, HardwareException;

    /**
     * Текущее положение становится нулем по всем осям
     */
    void setHome() throws TagException, HardwareException;

    boolean isMoving(Axis axis) throws TagNotCachedException;

    boolean isCoordinatedMoveInProgress() throws TagNotCachedException;

    /**
     * Расшифровка слова состояния оси
     *
     * @param axis ось
     * @return названия установленных битов
     * @throws TagNotCachedException если состояние еще не опрошено
     */
    List<String> getAxisStatusFlags(Axis axis) throws TagNotCachedException;

    HealthReport getHealth();
}
