package cold.spray.client.impl;

import cold.spray.client.FeederClient;
import cold.spray.configuration.SshConfiguration;
import cold.spray.enums.Device;
import cold.spray.exception.FeederConnectionException;
import cold.spray.exception.HardwareException;
import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Контроллер питателя через интерактивную оболочку по SSH
 */
public class SshFeederClientImpl implements FeederClient {
    private static final Logger logger = LoggerFactory.getLogger(SshFeederClientImpl.class);
    private final SshConfiguration configuration;
    private final JSch jsch = new JSch();
    private volatile Session session;
    private volatile ChannelShell channel;
    private volatile FeederShell shell;

    public SshFeederClientImpl(SshConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void connect() throws HardwareException {
        int maxAttempts = configuration.getMaxAttempts();
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                open();
                logger.info("Подключились к контроллеру питателя {}@{} с попытки {}",
                        configuration.getUsername(), configuration.getHost(), attempt);
                return;
            } catch (JSchException | IOException | HardwareException e) {
                lastError = e;
                logger.warn("Попытка {} из {} подключения к контроллеру питателя не удалась: {}",
                        attempt, maxAttempts, e.getMessage());
                disconnect();
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        logger.error("Не удалось подключиться к контроллеру питателя {}", configuration.getHost(), lastError);
        throw new FeederConnectionException(configuration.getHost(), maxAttempts, lastError);
    }

    private void open() throws JSchException, IOException, HardwareException {
        int timeout = (int) configuration.getTimeout().toMillis();
        Session newSession = jsch.getSession(configuration.getUsername(), configuration.getHost(), configuration.getPort());
        newSession.setPassword(configuration.getPassword());
        newSession.setConfig("StrictHostKeyChecking", "no");
        session = newSession;
        newSession.connect(timeout);

        ChannelShell newChannel = (ChannelShell) newSession.openChannel("shell");
        channel = newChannel;
        FeederShell newShell = new FeederShell(
                newChannel.getInputStream(),
                newChannel.getOutputStream(),
                configuration.getCommandTimeout(),
                configuration.getQueueCapacity()
        );
        newChannel.connect(timeout);
        shell = newShell;
        newShell.handshake(
                configuration.getHandshakeResponseDelay(),
                configuration.getHandshakeRetryDelay(),
                configuration.getReadBufferSize()
        );
    }

    private void pause() throws HardwareException {
        try {
            Thread.sleep(configuration.getRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HardwareException(Device.FEEDER, "connect", configuration.getHost(), "Подключение прервано", e);
        }
    }

    @Override
    public void disconnect() {
        FeederShell currentShell = shell;
        shell = null;
        if (currentShell != null) {
            currentShell.close();
        }
        ChannelShell currentChannel = channel;
        channel = null;
        if (currentChannel != null) {
            currentChannel.disconnect();
        }
        Session currentSession = session;
        session = null;
        if (currentSession != null) {
            currentSession.disconnect();
            logger.info("Отключились от контроллера питателя {}", configuration.getHost());
        }
    }

    @Override
    public boolean isConnected() {
        Session currentSession = session;
        return shell != null && currentSession != null && currentSession.isConnected();
    }

    @Override
    public Object readTag(String address) throws HardwareException {
        return requireShell("read", address).read(address);
    }

    @Override
    public void writeTag(String address, Object value) throws HardwareException {
        requireShell("write", address).write(address, value);
    }

    @Override
    public Device getDevice() {
        return Device.FEEDER;
    }

    private FeederShell requireShell(String operation, String address) throws HardwareException {
        FeederShell currentShell = shell;
        if (currentShell == null) {
            throw new HardwareException(Device.FEEDER, operation, address, "Нет подключения к контроллеру питателя");
        }
        return currentShell;
    }
}
