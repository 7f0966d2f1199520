package cold.spray;

import cold.spray.client.FeederClient;
import cold.spray.client.PlcClient;
import cold.spray.client.impl.MockFeederClientImpl;
import cold.spray.client.impl.MockPlcClientImpl;
import cold.spray.enums.GasLine;
import cold.spray.enums.GateValvePosition;
import cold.spray.enums.HealthStatus;
import cold.spray.enums.VacuumPump;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.ValidationException;
import cold.spray.model.HealthReport;
import cold.spray.service.EquipmentService;
import cold.spray.service.TagCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class EquipmentServiceTest extends AbstractTest {
    @Autowired
    EquipmentService equipmentService;

    @Autowired
    TagCacheService tagCacheService;

    @Autowired
    PlcClient plcClient;

    @Autowired
    FeederClient feederClient;

    private MockPlcClientImpl plc;

    private MockFeederClientImpl feeder;

    @BeforeEach
    void setUp() throws HardwareException {
        plcClient.connect();
        feederClient.connect();
        plc = (MockPlcClientImpl) plcClient;
        feeder = (MockFeederClientImpl) feederClient;
    }

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
    @DisplayName("Проверка уставок расхода газа")
    void checkFlowSetpoints() throws TagException, HardwareException {
        equipmentService.setMainFlow(42.5);
        assertEquals(42.5, plc.getRegister("AOS32-0.1.2.1"));

        /* уставка газа питателя уходит в ЦАП 12-битным значением */
        equipmentService.setFeederFlow(5.0);
        assertEquals(2048, plc.getRegister("AOS32-0.1.2.2"));
        assertEquals(5.0, tagCacheService.getTag("gas_control.feeder_flow.setpoint"));

        assertThrows(ValidationException.class, () -> equipmentService.setFeederFlow(10.5));
    }

    @Test
    @DisplayName("Проверка клапанов и заслонки")
    void checkValves() throws TagException, HardwareException {
        equipmentService.setGasValve(GasLine.MAIN, true);
        assertEquals(true, plc.getRegister("MainSwitch"));
        equipmentService.setGasValve(GasLine.FEEDER, false);
        assertEquals(false, plc.getRegister("FeederSwitch"));

        equipmentService.setVentValve(true);
        assertEquals(true, plc.getRegister("VentSwitch"));

        equipmentService.setShutter(true);
        assertEquals(true, plc.getRegister("Shutter"));
        assertEquals(true, tagCacheService.getTag("relay_control.shutter"));
    }

    @Test
    @DisplayName("Проверка положений шибера")
    void checkGateValve() throws TagException, HardwareException {
        equipmentService.setGateValve(GateValvePosition.OPEN);
        assertEquals(true, plc.getRegister("Open"));
        assertEquals(false, plc.getRegister("Partial"));

        equipmentService.setGateValve(GateValvePosition.PARTIAL);
        assertEquals(false, plc.getRegister("Open"));
        assertEquals(true, plc.getRegister("Partial"));

        equipmentService.setGateValve(GateValvePosition.CLOSED);
        assertEquals(false, plc.getRegister("Open"));
        assertEquals(false, plc.getRegister("Partial"));
    }

    @Test
    @DisplayName("Проверка выбора сопла")
    void checkNozzle() throws TagException, HardwareException {
        equipmentService.selectNozzle(2);
        assertEquals(true, plc.getRegister("NozzleSelect"));
        equipmentService.selectNozzle(1);
        assertEquals(false, plc.getRegister("NozzleSelect"));
        assertThrows(ValidationException.class, () -> equipmentService.selectNozzle(3));
    }

    @Test
    @DisplayName("Проверка частоты питателя")
    void checkFeederFrequency() throws TagException, HardwareException {
        equipmentService.setFeederFrequency(1, 800);
        assertEquals(800, feeder.getRegister("P6"));
        assertEquals(800, tagCacheService.getTag("gas_control.hardware_sets.set1.feeder.frequency"));

        equipmentService.setFeederFrequency(2, 1200);
        assertEquals(1200, feeder.getRegister("P106"));

        /* частота задается шагом 200 Гц */
        assertThrows(ValidationException.class, () -> equipmentService.setFeederFrequency(1, 700));
        assertThrows(ValidationException.class, () -> equipmentService.setFeederFrequency(2, 1400));
        assertThrows(ValidationException.class, () -> equipmentService.setFeederFrequency(3, 800));
        assertEquals(800, feeder.getRegister("P6"));
    }

    @Test
    @DisplayName("Проверка запуска и остановки питателя")
    void checkFeederRun() throws TagException, HardwareException {
        equipmentService.startFeeder(2);
        assertEquals(999, feeder.getRegister("P112"));
        assertEquals(1, feeder.getRegister("P110"));

        equipmentService.stopFeeder(2);
        assertEquals(4, feeder.getRegister("P110"));
        assertEquals(4, tagCacheService.getTag("gas_control.hardware_sets.set2.feeder.command"));
        assertThrows(ValidationException.class, () -> equipmentService.startFeeder(0));
    }

    @Test
    @DisplayName("Проверка скорости деагломератора")
    void checkDeagglomerator() throws TagException, HardwareException {
        equipmentService.setDeagglomeratorSpeed(1, "med");
        assertEquals(25, plc.getRegister("AOS32-0.1.6.1"));
        assertEquals("med", tagCacheService.getTag("gas_control.hardware_sets.set1.deagglomerator.duty_cycle"));

        assertThrows(ValidationException.class, () -> equipmentService.setDeagglomeratorSpeed(1, "turbo"));
        assertThrows(ValidationException.class, () -> equipmentService.setDeagglomeratorSpeed(3, "high"));
    }

    @Test
    @DisplayName("Проверка команд вакуумных насосов")
    void checkPumps() throws TagException, HardwareException {
        equipmentService.startPump(VacuumPump.MECHANICAL);
        assertEquals(true, plc.getRegister("MechPumpStart"));

        equipmentService.stopPump(VacuumPump.MECHANICAL);
        assertEquals(true, plc.getRegister("MechPumpStop"));
    }

    @Test
    @DisplayName("Проверка состояния оборудования без данных в кэше")
    void checkHealthWithoutData() {
        HealthReport report = equipmentService.getHealth();
        assertEquals(HealthStatus.ERROR, report.getStatus());
    }

    @Test
    @DisplayName("Проверка состояния оборудования при расходе по уставке и при отклонении")
    void checkHealthFlowDeviation() {
        invokePollMethod();
        assertEquals(HealthStatus.OK, equipmentService.getHealth().getStatus());

        /* расход газа питателя падает вдвое при открытом клапане */
        plc.seed("FeederFlowRate", 1024);
        invokePollMethod();
        HealthReport report = equipmentService.getHealth();
        assertEquals(HealthStatus.DEGRADED, report.getStatus());
        assertTrue(report.getProblems().containsKey("gas_control.feeder_flow.measured"));

        /* при закрытом клапане отклонение не считается проблемой */
        plc.seed("FeederSwitch", false);
        invokePollMethod();
        assertEquals(HealthStatus.OK, equipmentService.getHealth().getStatus());
    }
}
