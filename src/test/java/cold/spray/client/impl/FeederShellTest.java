package cold.spray.client.impl;

import cold.spray.exception.CommandQueueFullException;
import cold.spray.exception.HardwareException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FeederShellTest {
    private final Map<String, String> variables = new ConcurrentHashMap<>();
    private final List<String> receivedCommands = new CopyOnWriteArrayList<>();
    private final AtomicInteger lineModeErrors = new AtomicInteger();
    private volatile boolean silent;
    private PipedInputStream shellInput;
    private PipedOutputStream controllerOutput;
    private PipedOutputStream shellOutput;
    private PipedInputStream controllerInput;
    private Thread controller;

    @BeforeEach
    void setUp() throws IOException {
        shellInput = new PipedInputStream(4096);
        controllerOutput = new PipedOutputStream(shellInput);
        controllerInput = new PipedInputStream(4096);
        shellOutput = new PipedOutputStream(controllerInput);
        controller = new Thread(this::emulateController, "feeder-controller");
        controller.setDaemon(true);
        controller.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        controller.interrupt();
        shellOutput.close();
        controllerOutput.close();
    }

    /* построчная имитация оболочки gpascii: Px=v запоминает значение, Px отвечает Px=v */
    private void emulateController() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(controllerInput, StandardCharsets.US_ASCII));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                receivedCommands.add(line);
                if (line.startsWith("gpascii")) {
                    if (lineModeErrors.getAndDecrement() > 0) {
                        respond("stdin:1:1: error #20: ILLEGAL CMD\n");
                    } else {
                        respond("STDIN Open for ASCII Input\n");
                    }
                } else if (line.startsWith("echo")) {
                    respond("\n");
                } else if (line.contains("=")) {
                    String[] parts = line.split("=", 2);
                    variables.put(parts[0], parts[1]);
                } else if (!silent) {
                    respond(line + "=" + variables.getOrDefault(line, "0") + "\n");
                }
            }
        } catch (IOException e) {
            /* поток закрыт в конце теста */
        }
    }

    private void respond(String text) throws IOException {
        controllerOutput.write(text.getBytes(StandardCharsets.US_ASCII));
        controllerOutput.flush();
    }

    private FeederShell createShell(Duration commandTimeout, int queueCapacity) {
        return new FeederShell(shellInput, shellOutput, commandTimeout, queueCapacity);
    }

    @Test
    @DisplayName("Проверка записи и чтения P-переменной")
    void checkWriteAndRead() throws HardwareException {
        FeederShell shell = createShell(Duration.ofSeconds(2), 4);
        variables.put("P12", "999");

        shell.write("P6", 1200);
        assertEquals(1200, shell.read("P6"));
        assertEquals(999, shell.read("P12"));
        assertEquals(List.of("P6=1200", "P6", "P12"), receivedCommands);
        shell.close();
    }

    @Test
    @DisplayName("Проверка построчного режима и эха при подключении")
    void checkHandshake() throws HardwareException {
        FeederShell shell = createShell(Duration.ofSeconds(2), 4);
        shell.handshake(Duration.ofMillis(100), Duration.ofMillis(50), 1024);
        assertEquals(List.of("gpascii -2", "echo1"), receivedCommands);
        shell.close();
    }

    @Test
    @DisplayName("Проверка повтора перехода в построчный режим после ошибки контроллера")
    void checkHandshakeRetry() throws HardwareException {
        lineModeErrors.set(1);
        FeederShell shell = createShell(Duration.ofSeconds(2), 4);
        shell.handshake(Duration.ofMillis(100), Duration.ofMillis(50), 1024);
        assertEquals(List.of("gpascii -2", "gpascii -2", "echo1"), receivedCommands);
        shell.close();
    }

    @Test
    @DisplayName("Проверка ошибки подключения, если и повтор завершился ошибкой")
    void checkHandshakeFailure() {
        lineModeErrors.set(2);
        FeederShell shell = createShell(Duration.ofSeconds(2), 4);
        assertThrows(HardwareException.class,
                () -> shell.handshake(Duration.ofMillis(100), Duration.ofMillis(50), 1024));
        shell.close();
    }

    @Test
    @DisplayName("Проверка ошибки, если контроллер не ответил за время команды")
    void checkReadTimeout() {
        silent = true;
        FeederShell shell = createShell(Duration.ofMillis(200), 4);
        assertThrows(HardwareException.class, () -> shell.read("P6"));
        shell.close();
    }

    @Test
    @DisplayName("Проверка отказа при переполнении очереди команд")
    void checkQueueFull() throws InterruptedException {
        silent = true;
        FeederShell shell = createShell(Duration.ofSeconds(1), 1);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        /* первая команда занимает оболочку, вторая ждет в очереди */
        callers.submit(() -> shell.read("P1"));
        Thread.sleep(100);
        callers.submit(() -> shell.read("P2"));
        Thread.sleep(100);

        assertThrows(CommandQueueFullException.class, () -> shell.write("P3", 1));
        callers.shutdownNow();
        shell.close();
    }
}
