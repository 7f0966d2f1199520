package cold.spray.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SshConfiguration {
    @Value("${ssh.host}")
    private String host;

    @Value("${ssh.port:22}")
    private Integer port;

    @Value("${ssh.username}")
    private String username;

    @Value("${ssh.password}")
    private String password;

    @Value("${ssh.timeout:5s}")
    private Duration timeout;

    @Value("${ssh.commandTimeout:2s}")
    private Duration commandTimeout;

    @Value("${ssh.retry.maxAttempts:3}")
    private Integer maxAttempts;

    @Value("${ssh.retry.delay:5s}")
    private Duration retryDelay;

    @Value("${ssh.handshake.responseDelay:1s}")
    private Duration handshakeResponseDelay;

    @Value("${ssh.handshake.retryDelay:18s}")
    private Duration handshakeRetryDelay;

    @Value("${ssh.queueCapacity:16}")
    private Integer queueCapacity;

    @Value("${ssh.readBufferSize:1024}")
    private Integer readBufferSize;

    public String getHost() {
        return host;
    }

    public Integer getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getHandshakeResponseDelay() {
        return handshakeResponseDelay;
    }

    public Duration getHandshakeRetryDelay() {
        return handshakeRetryDelay;
    }

    public Integer getQueueCapacity() {
        return queueCapacity;
    }

    public Integer getReadBufferSize() {
        return readBufferSize;
    }
}
