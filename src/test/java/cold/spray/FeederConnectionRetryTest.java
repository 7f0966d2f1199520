package cold.spray;

import cold.spray.client.FeederClient;
import cold.spray.client.impl.SshFeederClientImpl;
import cold.spray.enums.Device;
import cold.spray.exception.FeederConnectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/* порт 1 на локальном адресе никто не слушает, каждая попытка отвергается сразу */
@SpringBootTest(
    properties = {
        "communication.forceMock = false",
        "ssh.host = 127.0.0.1",
        "ssh.port = 1",
        "ssh.timeout = 1s",
        "ssh.retry.maxAttempts = 2",
        "ssh.retry.delay = 10ms"
    })
@ActiveProfiles("test")
public class FeederConnectionRetryTest {
    @Autowired
    FeederClient feederClient;

    @Test
    @DisplayName("Проверка ошибки подключения к питателю после исчерпания попыток")
    void checkRetryExhausted() {
        assertInstanceOf(SshFeederClientImpl.class, feederClient);

        long startedAt = System.nanoTime();
        FeederConnectionException exception = assertThrows(FeederConnectionException.class, feederClient::connect);
        long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000;

        assertEquals(Device.FEEDER, exception.getDevice());
        assertTrue(exception.getMessage().contains("2 попыток"));
        assertNotNull(exception.getCause());
        /* между двумя попытками одна пауза */
        assertTrue(elapsedMillis >= 10);
        assertFalse(feederClient.isConnected());
    }
}
