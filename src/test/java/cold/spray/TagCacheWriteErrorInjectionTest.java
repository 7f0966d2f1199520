package cold.spray;

import cold.spray.client.FeederClient;
import cold.spray.client.PlcClient;
import cold.spray.client.impl.MockFeederClientImpl;
import cold.spray.client.impl.MockPlcClientImpl;
import cold.spray.event.error.TagWriteErrorEvent;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.service.TagCacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.event.ApplicationEvents;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DirtiesContext(classMode = ClassMode.AFTER_EACH_TEST_METHOD)
@TestPropertySource(properties = "mock.writeErrorRate = 1")
public class TagCacheWriteErrorInjectionTest extends AbstractTest {
    private static final String MAIN_SETPOINT = "gas_control.main_flow.setpoint";
    private static final String FEEDER_FREQUENCY = "gas_control.hardware_sets.set1.feeder.frequency";

    @Autowired
    TagCacheService tagCacheService;

    @Autowired
    PlcClient plcClient;

    @Autowired
    FeederClient feederClient;

    @Autowired
    private ApplicationEvents applicationEvents;

    private void invokePollMethod() {
        try {
            Method method = tagCacheService.getClass().getDeclaredMethod("poll");
            method.setAccessible(true);
            method.invoke(tagCacheService);
        } catch (Exception e) {
            throw new RuntimeException("Не удалось вызвать метод опроса ПЛК", e);
        }
    }

    @Test
    @DisplayName("Проверка сохранения кэша при ошибке записи в имитацию ПЛК")
    void checkPlcWriteError() throws TagException, HardwareException {
        plcClient.connect();
        invokePollMethod();
        Object before = tagCacheService.getTag(MAIN_SETPOINT);

        assertThrows(HardwareException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, 42.5));

        assertEquals(before, tagCacheService.getTag(MAIN_SETPOINT));
        assertEquals(before, ((MockPlcClientImpl) plcClient).getRegister("AOS32-0.1.2.1"));
        assertEquals(1, applicationEvents.stream(TagWriteErrorEvent.class).count());
    }

    @Test
    @DisplayName("Проверка ошибки записи скорости в имитацию питателя")
    void checkFeederWriteError() throws HardwareException {
        feederClient.connect();

        assertThrows(HardwareException.class, () -> tagCacheService.setTag(FEEDER_FREQUENCY, "high"));

        assertEquals(200, ((MockFeederClientImpl) feederClient).getRegister("P6"));
        assertThrows(TagException.class, () -> tagCacheService.getTag(FEEDER_FREQUENCY));
        assertEquals(1, applicationEvents.stream(TagWriteErrorEvent.class).count());
    }
}
