package cold.spray.client.impl;

import cold.spray.enums.Device;
import cold.spray.exception.CommandQueueFullException;
import cold.spray.exception.HardwareException;
import cold.spray.utils.FeederLineProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Интерактивная оболочка контроллера питателя.
 * Оболочка - один текстовый поток без мультиплексирования, поэтому команды идут строго по одной:
 * через ограниченную очередь и под блокировкой. Переполнение очереди - сразу ошибка, без ожидания
 */
public class FeederShell {
    private static final Logger logger = LoggerFactory.getLogger(FeederShell.class);
    private static final long POLL_PAUSE_MILLIS = 10;
    private final InputStream input;
    private final OutputStream output;
    private final Duration commandTimeout;
    private final int queueCapacity;
    private final ReentrantLock streamLock = new ReentrantLock();
    private final ThreadPoolExecutor commandExecutor;

    public FeederShell(InputStream input, OutputStream output, Duration commandTimeout, int queueCapacity) {
        this.input = input;
        this.output = output;
        this.commandTimeout = commandTimeout;
        this.queueCapacity = queueCapacity;
        this.commandExecutor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Перевод оболочки в построчный режим и проверка эха.
     * Если контроллер ответил ошибкой (обычно еще не загрузился) - ждем и повторяем один раз
     *
     * @param responseDelay  пауза перед чтением ответа
     * @param retryDelay     пауза перед повтором после ошибки
     * @param readBufferSize сколько байт ответа читать
     * @throws HardwareException если и повтор завершился ошибкой
     */
    public void handshake(Duration responseDelay, Duration retryDelay, int readBufferSize) throws HardwareException {
        streamLock.lock();
        try {
            logger.debug("Переводим оболочку питателя в построчный режим");
            String response = sendAndCollect(FeederLineProtocol.LINE_MODE_COMMAND, responseDelay, readBufferSize);
            if (FeederLineProtocol.isError(response)) {
                logger.warn("Контроллер питателя ответил ошибкой: {}, повторяем через {}", response.trim(), retryDelay);
                sleep(retryDelay, "handshake");
                response = sendAndCollect(FeederLineProtocol.LINE_MODE_COMMAND, responseDelay, readBufferSize);
                if (FeederLineProtocol.isError(response)) {
                    throw new HardwareException(Device.FEEDER, "handshake", null,
                            "Контроллер питателя не перешел в построчный режим: " + response.trim());
                }
            }
            String echo = sendAndCollect(FeederLineProtocol.ECHO_COMMAND, responseDelay, readBufferSize);
            logger.debug("Ответ на проверку эха: {}", echo.trim());
        } catch (IOException e) {
            throw new HardwareException(Device.FEEDER, "handshake", null, "Ошибка обмена с оболочкой питателя", e);
        } finally {
            streamLock.unlock();
        }
    }

    /**
     * Чтение P-переменной
     *
     * @param address имя переменной, например P6
     * @return целое, дробное или строковое значение
     * @throws HardwareException если ответ не получен за время команды или очередь переполнена
     */
    public Object read(String address) throws HardwareException {
        String command = FeederLineProtocol.formatRead(address);
        return execute(command, "read", address, () -> {
            drain();
            send(command);
            return FeederLineProtocol.parseValue(awaitResponse(address));
        });
    }

    public void write(String address, Object value) throws HardwareException {
        String command = FeederLineProtocol.formatWrite(address, value);
        execute(command, "write", address, () -> {
            drain();
            send(command);
            return null;
        });
    }

    public void close() {
        commandExecutor.shutdownNow();
    }

    private <T> T execute(String command, String operation, String address, Callable<T> task)
            throws HardwareException {
        Future<T> future;
        try {
            future = commandExecutor.submit(() -> {
                streamLock.lock();
                try {
                    return task.call();
                } finally {
                    streamLock.unlock();
                }
            });
        } catch (RejectedExecutionException e) {
            logger.error("Очередь команд питателя переполнена, команда {} отклонена", command.trim());
            throw new CommandQueueFullException(command.trim(), queueCapacity);
        }

        try {
            /* время ожидания в очереди не ограничиваем отдельно, оно входит в удвоенный таймаут */
            return future.get(commandTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HardwareException) {
                throw (HardwareException) cause;
            }
            throw new HardwareException(Device.FEEDER, operation, address, "Ошибка выполнения команды", cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HardwareException(Device.FEEDER, operation, address, "Команда не выполнена за отведенное время", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(Device.FEEDER, operation, address, "Ожидание команды прервано", e);
        }
    }

    private String awaitResponse(String address) throws IOException, HardwareException {
        long deadline = System.nanoTime() + commandTimeout.toNanos();
        StringBuilder line = new StringBuilder();
        byte[] buffer = new byte[256];
        while (System.nanoTime() < deadline) {
            if (input.available() <= 0) {
                sleep(Duration.ofMillis(POLL_PAUSE_MILLIS), "read");
                continue;
            }
            int count = input.read(buffer, 0, Math.min(buffer.length, input.available()));
            if (count < 0) {
                throw new HardwareException(Device.FEEDER, "read", address, "Оболочка питателя закрыла поток");
            }
            for (int i = 0; i < count; i++) {
                char c = (char) buffer[i];
                if (c == '\n' || c == '\r') {
                    String value = FeederLineProtocol.parseResponse(address, line.toString());
                    if (value != null) {
                        return value;
                    }
                    line.setLength(0);
                } else {
                    line.append(c);
                }
            }
        }
        String value = FeederLineProtocol.parseResponse(address, line.toString());
        if (value != null) {
            return value;
        }
        throw new HardwareException(Device.FEEDER, "read", address,
                "Нет ответа от контроллера питателя за " + commandTimeout.toMillis() + " мс");
    }

    private String sendAndCollect(String command, Duration responseDelay, int readBufferSize)
            throws IOException, HardwareException {
        send(command);
        sleep(responseDelay, "handshake");
        int available = Math.min(input.available(), readBufferSize);
        if (available <= 0) {
            return "";
        }
        byte[] buffer = new byte[available];
        int count = input.read(buffer, 0, available);
        return count > 0 ? new String(buffer, 0, count, StandardCharsets.US_ASCII) : "";
    }

    private void send(String command) throws IOException {
        logger.debug("Команда питателю: {}", command.trim());
        output.write(command.getBytes(StandardCharsets.US_ASCII));
        output.flush();
    }

    /* эхо прошлых команд не должно попасть в разбор ответа */
    private void drain() throws IOException {
        while (input.available() > 0) {
            long skipped = input.skip(input.available());
            logger.trace("Пропущено {} байт старого вывода оболочки", skipped);
        }
    }

    private void sleep(Duration duration, String operation) throws HardwareException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(Device.FEEDER, operation, null, "Ожидание ответа прервано", e);
        }
    }
}
