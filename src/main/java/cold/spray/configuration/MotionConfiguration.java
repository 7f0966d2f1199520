package cold.spray.configuration;

import cold.spray.enums.Axis;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class MotionConfiguration {
    @Value("${motion.limits.x.min}")
    private Double xMin;

    @Value("${motion.limits.x.max}")
    private Double xMax;

    @Value("${motion.limits.y.min}")
    private Double yMin;

    @Value("${motion.limits.y.max}")
    private Double yMax;

    @Value("${motion.limits.z.min}")
    private Double zMin;

    @Value("${motion.limits.z.max}")
    private Double zMax;

    @Value("${motion.staleAfter:5s}")
    private Duration staleAfter;

    /**
     * Программные пределы перемещения по оси
     *
     * @param axis ось
     * @return пара минимум - максимум в мм
     */
    public Pair<Double, Double> getLimits(Axis axis) {
        return switch (axis) {
            case X -> Pair.of(xMin, xMax);
            case Y -> Pair.of(yMin, yMax);
            case Z -> Pair.of(zMin, zMax);
        };
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }
}
