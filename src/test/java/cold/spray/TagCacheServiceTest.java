package cold.spray;

import cold.spray.client.FeederClient;
import cold.spray.client.PlcClient;
import cold.spray.client.impl.MockFeederClientImpl;
import cold.spray.client.impl.MockPlcClientImpl;
import cold.spray.event.error.TagWriteErrorEvent;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.exception.UnknownTagException;
import cold.spray.exception.ValidationException;
import cold.spray.model.TagValue;
import cold.spray.service.TagCacheService;
import cold.spray.service.TagStateCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.event.ApplicationEvents;

import java.lang.reflect.Method;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DirtiesContext(classMode = ClassMode.AFTER_EACH_TEST_METHOD)
public class TagCacheServiceTest extends AbstractTest {
    private static final String MAIN_SETPOINT = "gas_control.main_flow.setpoint";
    private static final String MAIN_MEASURED = "gas_control.main_flow.measured";
    private static final String FEEDER_FREQUENCY = "gas_control.hardware_sets.set1.feeder.frequency";
    private static final String SYSTEM_STATE = "system_state.state";

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
    @DisplayName("Проверка записи тега ПЛК через имитацию и обновления кэша")
    void checkPlcWrite() throws TagException, HardwareException {
        plcClient.connect();
        Instant initializedAt = tagCacheService.getInitializedAt();

        tagCacheService.setTag(MAIN_SETPOINT, 42.5);

        assertEquals(42.5, tagCacheService.getTag(MAIN_SETPOINT));
        assertTrue(tagCacheService.getTagWithMetadata(MAIN_SETPOINT).getTimestamp().isAfter(initializedAt));
        assertEquals(42.5, ((MockPlcClientImpl) plcClient).getRegister("AOS32-0.1.2.1"));
    }

    @Test
    @DisplayName("Проверка записи скорости питателя по названию")
    void checkFeederSpeedWrite() throws TagException, HardwareException {
        feederClient.connect();

        tagCacheService.setTag(FEEDER_FREQUENCY, "high");

        assertEquals(1200, ((MockFeederClientImpl) feederClient).getRegister("P6"));
        assertEquals("high", tagCacheService.getTag(FEEDER_FREQUENCY));
    }

    @Test
    @DisplayName("Проверка записи значения на верхней границе диапазона и за ней")
    void checkRangeBoundary() throws TagException, HardwareException {
        plcClient.connect();

        tagCacheService.setTag(MAIN_SETPOINT, 100.0);
        assertEquals(100.0, tagCacheService.getTag(MAIN_SETPOINT));

        assertThrows(ValidationException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, 100.0001));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, -0.5));
        assertEquals(100.0, tagCacheService.getTag(MAIN_SETPOINT));
    }

    @Test
    @DisplayName("Проверка отказа в записи до обращения к оборудованию")
    void checkValidationBeforeHardware() {
        /* имитация не подключена - любая попытка записи в оборудование закончилась бы ошибкой оборудования */
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(MAIN_MEASURED, 10.0));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, "сорок"));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, null));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(FEEDER_FREQUENCY, "turbo"));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(FEEDER_FREQUENCY, 600.5));
        assertThrows(ValidationException.class, () -> tagCacheService.setTag(FEEDER_FREQUENCY, 100));
        assertThrows(UnknownTagException.class, () -> tagCacheService.setTag("no.such.tag", 1));
        assertThrows(ValidationException.class, () -> tagCacheService.validateValue("pressure.chamber_pressure", 1.0));
        assertEquals(0, applicationEvents.stream(TagWriteErrorEvent.class).count());
    }

    @Test
    @DisplayName("Проверка ошибки оборудования при записи без подключения")
    void checkWriteWithoutConnection() {
        assertThrows(HardwareException.class, () -> tagCacheService.setTag(MAIN_SETPOINT, 10.0));
        assertThrows(TagNotCachedException.class, () -> tagCacheService.getTag(MAIN_SETPOINT));
        assertEquals(
                1,
                applicationEvents.stream(TagWriteErrorEvent.class)
                        .filter(event -> MAIN_SETPOINT.equals(event.getTag())).count()
        );
    }

    @Test
    @DisplayName("Проверка заполнения кэша опросом ПЛК")
    void checkPoll() throws TagException, HardwareException {
        assertThrows(TagNotCachedException.class, () -> tagCacheService.getTagWithMetadata(MAIN_MEASURED));
        plcClient.connect();
        invokePollMethod();

        assertEquals(0.0, tagCacheService.getTag(MAIN_MEASURED));
        assertEquals(5.0, (Double) tagCacheService.getTag("gas_control.feeder_flow.measured"), 0.01);
        assertEquals(50.0, tagCacheService.getTag("motion.position.x_position"));
        assertEquals("off", tagCacheService.getTag("gas_control.hardware_sets.set1.deagglomerator.duty_cycle"));
        assertEquals(true, tagCacheService.getTag("interlocks.motion_ready"));

        TagValue pressure = tagCacheService.getTagWithMetadata("pressure.chamber_pressure");
        assertEquals("torr", pressure.getDefinition().getUnit());
        assertEquals(21 * 1000.0 / 4095, pressure.asDouble(), 0.001);

        Map<String, TagValue> motion = tagCacheService.getGroupTags("motion");
        assertTrue(motion.containsKey("motion.position.z_position"));
        assertFalse(motion.containsKey(MAIN_MEASURED));
        assertTrue(tagCacheService.getAllTags().keySet().stream().noneMatch(tag -> tag.startsWith("diagnostics")));
    }

    @Test
    @DisplayName("Проверка переподключения к ПЛК при опросе")
    void checkPollReconnect() throws TagException {
        assertFalse(plcClient.isConnected());
        invokePollMethod();
        assertTrue(plcClient.isConnected());
        assertEquals(50.0, tagCacheService.getTag("motion.position.y_position"));
    }

    @Test
    @DisplayName("Проверка очистки кэша")
    void checkClear() throws HardwareException {
        plcClient.connect();
        invokePollMethod();
        assertFalse(tagCacheService.getAllTags().isEmpty());

        tagCacheService.clearCache();
        assertTrue(tagCacheService.getAllTags().isEmpty());
        assertThrows(TagNotCachedException.class, () -> tagCacheService.getTag(MAIN_MEASURED));
    }

    @Test
    @DisplayName("Проверка внутреннего тега без адреса оборудования")
    void checkInternalTag() throws TagException, HardwareException {
        tagCacheService.setTag(SYSTEM_STATE, "READY");
        assertEquals("READY", tagCacheService.getTag(SYSTEM_STATE));
        assertEquals(0, applicationEvents.stream(TagWriteErrorEvent.class).count());
    }

    @Test
    @DisplayName("Проверка уведомления подписчиков об изменении тега")
    void checkCallbacks() throws TagException, HardwareException {
        List<String> changes = new ArrayList<>();
        tagCacheService.addStateCallback((tag, oldValue, newValue) -> {
            throw new IllegalStateException("ошибка подписчика не должна мешать остальным");
        });
        tagCacheService.addStateCallback((tag, oldValue, newValue) -> changes.add(tag + ":" + oldValue + "->" + newValue));

        tagCacheService.setTag(SYSTEM_STATE, "READY");
        tagCacheService.setTag(SYSTEM_STATE, "READY");
        tagCacheService.setTag(SYSTEM_STATE, "RUNNING");
        assertEquals(List.of(SYSTEM_STATE + ":null->READY", SYSTEM_STATE + ":READY->RUNNING"), changes);
    }

    @Test
    @DisplayName("Проверка отписки от изменений тегов")
    void checkRemoveCallback() throws TagException, HardwareException {
        List<Object> values = new ArrayList<>();
        TagStateCallback callback = (tag, oldValue, newValue) -> values.add(newValue);
        tagCacheService.addStateCallback(callback);
        tagCacheService.setTag(SYSTEM_STATE, "READY");
        tagCacheService.removeStateCallback(callback);
        tagCacheService.setTag(SYSTEM_STATE, "RUNNING");
        assertEquals(List.of("READY"), values);
    }

    @Test
    @DisplayName("Проверка запуска и остановки фонового опроса")
    void checkStartStop() throws TagException, InterruptedException {
        assertFalse(tagCacheService.isRunning());
        tagCacheService.start();
        tagCacheService.start();
        assertTrue(tagCacheService.isRunning());

        Instant deadline = Instant.now().plusSeconds(5);
        while (tagCacheService.getAllTags().isEmpty() && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
        }
        assertEquals(50.0, tagCacheService.getTag("motion.position.x_position"));

        tagCacheService.stop();
        assertFalse(tagCacheService.isRunning());
        Instant lastUpdate = tagCacheService.getTagWithMetadata("motion.position.x_position").getTimestamp();
        Thread.sleep(200);
        assertEquals(lastUpdate, tagCacheService.getTagWithMetadata("motion.position.x_position").getTimestamp());
    }

    @Test
    @DisplayName("Проверка времени инициализации кэша")
    void checkInitialize() {
        Instant before = tagCacheService.getInitializedAt();
        tagCacheService.initialize();
        assertTrue(tagCacheService.getInitializedAt().isAfter(before));
    }
}
