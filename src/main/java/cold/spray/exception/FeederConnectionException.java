package cold.spray.exception;

import cold.spray.enums.Device;

public class FeederConnectionException extends HardwareException {
    public FeederConnectionException(String host, int attempts, Throwable cause) {
        super(Device.FEEDER, "connect", host,
                "Не удалось подключиться к контроллеру питателя за " + attempts + " попыток", cause);
    }
}
